package works.trellis.blog.state;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Comparator.comparingLong;
import static java.util.stream.Collectors.toList;

/**
 * The blog's content, held in memory.
 * Safe to read and write from multiple threads.
 */
public final class BlogStore {
	private final Map<Long, Author> authors = new ConcurrentHashMap<>();
	private final Map<Long, Article> articles = new ConcurrentHashMap<>();

	public BlogStore add(Author author) {
		authors.put(author.id(), author);
		return this;
	}

	public BlogStore add(Article article) {
		articles.put(article.id(), article);
		return this;
	}

	public Optional<Author> author(long id) {
		return Optional.ofNullable(authors.get(id));
	}

	public Optional<Article> article(long id) {
		return Optional.ofNullable(articles.get(id));
	}

	public List<Article> articles() {
		return sorted(articles.values());
	}

	public List<Article> articlesBy(long authorId) {
		return sorted(articles.values().stream()
			.filter(a -> a.authorId() == authorId)
			.collect(toList()));
	}

	private static List<Article> sorted(Collection<Article> articles) {
		return articles.stream()
			.sorted(comparingLong(Article::id))
			.collect(toList());
	}

	/**
	 * A few authors and articles to play with.
	 */
	public static BlogStore sample() {
		return new BlogStore()
			.add(new Author(1, "Ada"))
			.add(new Author(2, "Grace"))
			.add(new Article(1, 1, "Hello, world", false, List.of("First!", "Welcome aboard")))
			.add(new Article(2, 2, "On compilers", false, List.of()))
			.add(new Article(3, 1, "Half-finished thoughts", true, List.of()));
	}
}
