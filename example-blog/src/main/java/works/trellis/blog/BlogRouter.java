package works.trellis.blog;

import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.trellis.Resource;
import works.trellis.Route;
import works.trellis.blog.state.BlogStore;
import works.trellis.exceptions.ChildNotFoundException;
import works.trellis.exceptions.InvalidTreeException;

import static java.util.stream.Collectors.toList;

/**
 * Turns raw request paths into resources of a {@link BlogTree}.
 * <p>
 * Empty segments are ignored, so {@code /posts/1}, {@code posts/1/} and {@code //posts//1}
 * all name the same resource.
 */
public final class BlogRouter {
	private final BlogTree blog;

	public BlogRouter(BlogTree blog) {
		this.blog = blog;
	}

	public Resource route(String rawPath) throws ChildNotFoundException {
		List<String> segments = segmentsOf(rawPath);
		LOGGER.debug("Routing {} as {}", rawPath, segments);
		return blog.tree().root().resolvePath(segments);
	}

	/**
	 * @return a one-line description of whatever {@code rawPath} names, or of why it names nothing
	 */
	public String describe(String rawPath) {
		Resource resource;
		try {
			resource = route(rawPath);
		} catch (ChildNotFoundException e) {
			return "404 " + e.getMessage();
		}
		if (resource instanceof BlogTree.ArticlePage p) {
			return "200 " + p.uri() + " \"" + p.article().title() + "\"";
		} else if (resource instanceof BlogTree.ArticleList l) {
			return "200 " + l.uri() + " " + l.articles().size() + " article(s)";
		} else if (resource instanceof BlogTree.CommentList c) {
			return "200 " + c.uri() + " " + c.comments().size() + " comment(s)";
		} else if (resource instanceof BlogTree.AuthorPage a) {
			return "200 " + a.uri() + " " + a.author().displayName();
		} else if (resource instanceof BlogTree.CategoryPage c) {
			return "200 " + c.uri() + " category " + c.path();
		} else {
			return "200 " + resource.uri();
		}
	}

	static List<String> segmentsOf(String rawPath) {
		return Arrays.stream(rawPath.split("/"))
			.filter(s -> !s.isEmpty())
			.collect(toList());
	}

	/**
	 * Prints the blog's routes, then describes each path given on the command line.
	 */
	public static void main(String[] args) throws InvalidTreeException {
		BlogTree blog = new BlogTree(BlogStore.sample());
		for (Route route : blog.tree().routes()) {
			System.out.println(route.uri() + "\t" + route.target());
		}
		BlogRouter router = new BlogRouter(blog);
		for (String arg : args) {
			System.out.println(arg + "\t" + router.describe(arg));
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BlogRouter.class);
}
