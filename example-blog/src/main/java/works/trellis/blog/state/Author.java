package works.trellis.blog.state;

public record Author(long id, String displayName) { }
