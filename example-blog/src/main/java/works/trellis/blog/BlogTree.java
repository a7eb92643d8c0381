package works.trellis.blog;

import java.util.ArrayList;
import java.util.List;
import works.trellis.ChildFactory;
import works.trellis.NodeType;
import works.trellis.Resource;
import works.trellis.ResourceTree;
import works.trellis.TreeBuilder;
import works.trellis.blog.state.Article;
import works.trellis.blog.state.Author;
import works.trellis.blog.state.BlogStore;
import works.trellis.exceptions.ChildNotFoundException;
import works.trellis.exceptions.InvalidTreeException;
import works.trellis.exceptions.NonexistentResourceException;

import static works.trellis.conditions.Conditions.DEC_ID;
import static works.trellis.conditions.Conditions.TEXT_ID;
import static works.trellis.conditions.Conditions.not;
import static works.trellis.conditions.Conditions.recursion;
import static works.trellis.conditions.Conditions.underNamed;

/**
 * The blog's URL space:
 *
 * <pre>
 * /posts/{post_id}/comments/
 * /drafts/{post_id}/
 * /users/{user_id}/posts/{post_id}/comments/
 * /categories/{category}/{category}/...
 * </pre>
 *
 * The same article list and article types serve all three article listings;
 * each resource works out which articles it may show from where it sits in the tree.
 */
public final class BlogTree {
	public static final int MAX_CATEGORY_DEPTH = 3;

	public final NodeType<Site> site;
	public final NodeType<ArticleList> articleList;
	public final NodeType<ArticlePage> articlePage;
	public final NodeType<CommentList> commentList;
	public final NodeType<AuthorList> authorList;
	public final NodeType<AuthorPage> authorPage;
	public final NodeType<CategoryList> categoryList;
	public final NodeType<CategoryPage> categoryPage;

	private final ResourceTree<Site> tree;

	public BlogTree(BlogStore store) throws InvalidTreeException {
		site = NodeType.of(Site.class, Site::new);
		articleList = NodeType.of(ArticleList.class, () -> new ArticleList(store));
		articlePage = NodeType.of(ArticlePage.class, () -> new ArticlePage(store));
		commentList = NodeType.of(CommentList.class, CommentList::new);
		authorList = NodeType.of(AuthorList.class, AuthorList::new);
		authorPage = NodeType.of(AuthorPage.class, () -> new AuthorPage(store));
		categoryList = NodeType.of(CategoryList.class, CategoryList::new);
		categoryPage = NodeType.of(CategoryPage.class, CategoryPage::new);

		tree = TreeBuilder.named("blog")
			.mountStatic(site, "posts", articleList)
			.mountStatic(site, "drafts", articleList)
			.mountStatic(site, "users", authorList)
			.mountStatic(site, "categories", categoryList)
			.mountDynamic(authorList, DEC_ID, authorPage, "user_id")
			.mountStatic(authorPage, "posts", articleList)
			.mountDynamic(articleList, DEC_ID, articlePage, "post_id")
			.mountStatic(articlePage, "comments", commentList, not(underNamed("drafts")))
			.mountDynamic(categoryList, recursion(TEXT_ID, MAX_CATEGORY_DEPTH), categoryPage, "category")
			.mountDynamic(categoryPage, recursion(TEXT_ID, MAX_CATEGORY_DEPTH), categoryPage, "category")
			.build(site);
	}

	public ResourceTree<Site> tree() {
		return tree;
	}

	public static class Site extends Resource { }

	/**
	 * Lists drafts beneath {@code /drafts}, an author's published articles beneath an author,
	 * and all published articles otherwise.
	 */
	public static class ArticleList extends Resource {
		private final BlogStore store;

		ArticleList(BlogStore store) {
			this.store = store;
		}

		public boolean showsDrafts() {
			return "drafts".equals(name());
		}

		public List<Article> articles() {
			List<Article> candidates = (parent() instanceof AuthorPage a)
				? store.articlesBy(a.author().id())
				: store.articles();
			return candidates.stream()
				.filter(this::lists)
				.toList();
		}

		/**
		 * @return a page for each of the {@link #articles()}, created without looking them up again
		 */
		public List<ArticlePage> pages() throws ChildNotFoundException {
			ChildFactory factory = childFactory("post_id");
			List<ArticlePage> result = new ArrayList<>();
			for (Article article : articles()) {
				result.add((ArticlePage) factory.create(Long.toString(article.id()), article));
			}
			return result;
		}

		boolean lists(Article article) {
			if (article.draft() != showsDrafts()) {
				return false;
			}
			return !(parent() instanceof AuthorPage a) || a.author().id() == article.authorId();
		}
	}

	public static class ArticlePage extends Resource {
		private final BlogStore store;
		private Article article;

		ArticlePage(BlogStore store) {
			this.store = store;
		}

		@Override
		protected void onInit() throws NonexistentResourceException {
			long id = metadata().get("post_id", Long.class);
			Article found;
			if (payload() instanceof Article a && a.id() == id) {
				found = a;
			} else {
				found = store.article(id)
					.orElseThrow(() -> new NonexistentResourceException("No article " + id));
			}
			if (!((ArticleList) parent()).lists(found)) {
				throw new NonexistentResourceException("Article " + id + " is not listed under " + parent().uri());
			}
			this.article = found;
		}

		public Article article() {
			return article;
		}
	}

	public static class CommentList extends Resource {
		public List<String> comments() {
			return ((ArticlePage) parent()).article().comments();
		}
	}

	public static class AuthorList extends Resource { }

	public static class AuthorPage extends Resource {
		private final BlogStore store;
		private Author author;

		AuthorPage(BlogStore store) {
			this.store = store;
		}

		@Override
		protected void onInit() throws NonexistentResourceException {
			long id = metadata().get("user_id", Long.class);
			this.author = store.author(id)
				.orElseThrow(() -> new NonexistentResourceException("No author " + id));
		}

		public Author author() {
			return author;
		}
	}

	public static class CategoryList extends Resource { }

	/**
	 * A node in a free-form category hierarchy, like {@code /categories/science/physics/}.
	 */
	public static class CategoryPage extends Resource {
		/**
		 * @return the category names from the outermost down to this one
		 */
		public List<?> path() {
			return metadata().get("category", List.class);
		}
	}
}
