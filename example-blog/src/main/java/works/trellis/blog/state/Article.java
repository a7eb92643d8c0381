package works.trellis.blog.state;

import java.util.List;

public record Article(
	long id,
	long authorId,
	String title,
	boolean draft,
	List<String> comments
) {
	public Article {
		comments = List.copyOf(comments);
	}
}
