package works.trellis.conditions;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.trellis.Metadata;
import works.trellis.NodeType;
import works.trellis.Resource;
import works.trellis.ResourceTree;
import works.trellis.Route;
import works.trellis.TreeBuilder;
import works.trellis.exceptions.ChildNotFoundException;
import works.trellis.exceptions.InvalidTreeException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.trellis.conditions.Conditions.ANY_ID;
import static works.trellis.conditions.Conditions.DEC_ID;
import static works.trellis.conditions.Conditions.HEX_ID;
import static works.trellis.conditions.Conditions.TEXT_ID;
import static works.trellis.conditions.Conditions.allOf;
import static works.trellis.conditions.Conditions.anyOf;
import static works.trellis.conditions.Conditions.literal;
import static works.trellis.conditions.Conditions.matching;
import static works.trellis.conditions.Conditions.not;
import static works.trellis.conditions.Conditions.recursion;
import static works.trellis.conditions.Conditions.under;
import static works.trellis.conditions.Conditions.underNamed;

class ConditionsTest {
	public static class Site extends Resource { }
	public static class Section extends Resource { }
	public static class Page extends Resource { }

	static final NodeType<Site> SITE = NodeType.of(Site.class, Site::new);
	static final NodeType<Section> SECTION = NodeType.of(Section.class, Section::new);
	static final NodeType<Page> PAGE = NodeType.of(Page.class, Page::new);

	ResourceTree<Site> tree;
	Site site;
	Resource blog;

	@BeforeEach
	void setup() throws InvalidTreeException, ChildNotFoundException {
		tree = TreeBuilder.named("conditions")
			.mountStatic(SITE, "blog", SECTION)
			.mountStatic(SITE, "wiki", SECTION)
			.mountDynamic(SECTION, TEXT_ID, PAGE, "slug")
			.build(SITE);
		site = tree.root();
		blog = site.get("blog");
	}

	MatchContext underBlog(String metaname) {
		return new MatchContext(blog, PAGE, metaname);
	}

	@Test
	void literal_matchesExactly() {
		Condition c = literal("about");
		assertTrue(c.match("about", underBlog("x")).matched());
		assertFalse(c.match("About", underBlog("x")).matched());
		assertTrue(c.match("about", underBlog("x")).metadata().isEmpty());
		assertEquals("about", c.defaultMetaname());
	}

	@ParameterizedTest
	@ValueSource(strings = { "0", "7", "0042", "9223372036854775807" })
	void decimalId_matchesDigits(String segment) {
		MatchResult result = DEC_ID.match(segment, underBlog("post_id"));
		assertTrue(result.matched());
		assertEquals(Long.parseLong(segment), result.metadata().get("post_id"));
	}

	@ParameterizedTest
	@ValueSource(strings = { "", "-1", "+1", "1.5", "12a", " 1", "١", "9223372036854775808" })
	void decimalId_rejectsEverythingElse(String segment) {
		MatchResult result = DEC_ID.match(segment, underBlog("post_id"));
		assertFalse(result.matched());
		assertTrue(result.metadata().isEmpty());
	}

	@Test
	void builtInPatterns() {
		assertTrue(HEX_ID.match("deadBEEF01", underBlog("id")).matched());
		assertFalse(HEX_ID.match("xyz", underBlog("id")).matched());
		assertTrue(TEXT_ID.match("hello-world_2", underBlog("id")).matched());
		assertFalse(TEXT_ID.match("hello world", underBlog("id")).matched());
		assertTrue(ANY_ID.match("", underBlog("id")).matched());
		assertTrue(ANY_ID.match("Some File 123", underBlog("id")).matched());
		assertEquals("Some File 123", ANY_ID.match("Some File 123", underBlog("file")).metadata().get("file"));
	}

	@Test
	void matching_customPattern() {
		Condition c = matching("\\d+-[\\w\\-]+", "slug");
		assertTrue(c.match("1-first-post", underBlog("slug")).matched());
		assertFalse(c.match("1", underBlog("slug")).matched());
		assertEquals("slug", c.defaultMetaname());
	}

	@ParameterizedTest
	@ValueSource(strings = { "12", "ab", "12ab", "" })
	void and_matchesWhenBothMatch(String segment) {
		Condition c1 = HEX_ID;
		Condition c2 = TEXT_ID;
		boolean expected = c1.match(segment, underBlog("k")).matched() && c2.match(segment, underBlog("k")).matched();
		assertEquals(expected, allOf(c1, c2).match(segment, underBlog("k")).matched());
		assertEquals(expected, c1.and(c2).match(segment, underBlog("k")).matched());
	}

	@ParameterizedTest
	@ValueSource(strings = { "12", "ab", "a b", "" })
	void or_matchesWhenEitherMatches(String segment) {
		Condition c1 = DEC_ID;
		Condition c2 = TEXT_ID;
		boolean expected = c1.match(segment, underBlog("k")).matched() || c2.match(segment, underBlog("k")).matched();
		assertEquals(expected, anyOf(c1, c2).match(segment, underBlog("k")).matched());
		assertEquals(expected, c1.or(c2).match(segment, underBlog("k")).matched());
	}

	@Test
	void or_firstMatchWins() {
		MatchResult result = anyOf(DEC_ID, TEXT_ID).match("12", underBlog("k"));
		assertEquals(12L, result.metadata().get("k"));

		result = anyOf(TEXT_ID, DEC_ID).match("12", underBlog("k"));
		assertEquals("12", result.metadata().get("k"));
	}

	@Test
	void and_laterMetadataWins() {
		MatchResult result = allOf(DEC_ID, TEXT_ID).match("12", underBlog("k"));
		assertEquals("12", result.metadata().get("k"));

		result = allOf(TEXT_ID, DEC_ID).match("12", underBlog("k"));
		assertEquals(12L, result.metadata().get("k"));
	}

	@ParameterizedTest
	@ValueSource(strings = { "12", "ab" })
	void not_invertsAndDiscardsMetadata(String segment) {
		boolean inner = DEC_ID.match(segment, underBlog("k")).matched();
		MatchResult result = not(DEC_ID).match(segment, underBlog("k"));
		assertEquals(!inner, result.matched());
		assertEquals(Metadata.empty(), result.metadata());
		assertEquals(!inner, DEC_ID.not().match(segment, underBlog("k")).matched());
	}

	@Test
	void matchedEmpty_hasNoMetadata() {
		assertTrue(MatchResult.matchedEmpty().matched());
		assertEquals(Metadata.empty(), MatchResult.matchedEmpty().metadata());
		assertFalse(MatchResult.notMatched().matched());
		assertEquals(MatchResult.matchedEmpty(), literal("a").match("a", underBlog("k")));
	}

	@Test
	void combinators_requireConditions() {
		assertThrows(IllegalArgumentException.class, () -> new And(List.of()));
		assertThrows(IllegalArgumentException.class, () -> new Or(List.of()));
	}

	@Test
	void under_checksAncestorTypes() throws ChildNotFoundException {
		assertTrue(under(SECTION).match("anything", underBlog("k")).matched());
		assertTrue(under(SITE).match("anything", underBlog("k")).matched());
		assertFalse(under(PAGE).match("anything", underBlog("k")).matched());
		assertFalse(under(SECTION).match("anything", new MatchContext(site, SECTION, "k")).matched());
	}

	@Test
	void under_checksAncestorNames() throws ChildNotFoundException {
		Resource wiki = site.get("wiki");
		assertTrue(underNamed("blog").match("x", underBlog("k")).matched());
		assertFalse(underNamed("blog").match("x", new MatchContext(wiki, PAGE, "k")).matched());
		assertTrue(underNamed("blog", "wiki").match("x", new MatchContext(wiki, PAGE, "k")).matched());
	}

	@Test
	void under_ignoresNamesOfDynamicallyResolvedAncestors() throws ChildNotFoundException {
		// A page whose slug happens to be "blog" is not the blog section
		Resource page = site.resolvePath("wiki", "blog");
		assertFalse(underNamed("blog").match("x", new MatchContext(page, PAGE, "k")).matched());
		assertTrue(underNamed("wiki").match("x", new MatchContext(page, PAGE, "k")).matched());
		assertTrue(not(underNamed("blog")).match("x", new MatchContext(page, PAGE, "k")).matched());
	}

	@Test
	void under_ignoresTheResourceBeingCreated() {
		assertFalse(under(PAGE).match("x", underBlog("k")).matched());
		assertFalse(underNamed("x").match("x", new MatchContext(site, SECTION, "x")).matched());
	}

	@Test
	void under_withSubcondition_delegatesMetadata() {
		Condition c = under(SECTION, DEC_ID);
		assertEquals(5L, c.match("5", underBlog("n")).metadata().get("n"));
		assertFalse(c.match("five", underBlog("n")).matched());
		assertEquals("id", c.defaultMetaname());
	}

	@Test
	void recursion_capturesEachLevel() throws InvalidTreeException, ChildNotFoundException {
		NodeType<Folder> folder = NodeType.of(Folder.class, Folder::new);
		Folder root = TreeBuilder.named("folders")
			.mountDynamic(folder, recursion(TEXT_ID), folder, "path")
			.build(folder)
			.root();

		Resource b = root.resolvePath("docs", "a", "b");
		assertEquals(List.of("docs", "a", "b"), b.metadata().get("path"));
		assertEquals(List.of("docs", "a"), b.parent().metadata().get("path"));
	}

	@Test
	void recursion_capturesSubconditionValues() throws InvalidTreeException, ChildNotFoundException {
		NodeType<Folder> folder = NodeType.of(Folder.class, Folder::new);
		Folder root = TreeBuilder.named("numbered")
			.mountDynamic(folder, recursion(DEC_ID), folder, "ids")
			.build(folder)
			.root();

		assertEquals(List.of(3L, 1L, 4L), root.resolvePath("3", "1", "4").metadata().get("ids"));
		assertThrows(ChildNotFoundException.class, () -> root.resolvePath("3", "x"));
	}

	@Test
	void recursion_respectsMaxDepth() throws InvalidTreeException, ChildNotFoundException {
		NodeType<Folder> folder = NodeType.of(Folder.class, Folder::new);
		Folder root = TreeBuilder.named("shallow")
			.mountDynamic(folder, recursion(TEXT_ID, 3), folder, "path")
			.build(folder)
			.root();

		// The root is a folder too, so it counts toward the depth
		root.resolvePath("a", "b");
		ChildNotFoundException e = assertThrows(ChildNotFoundException.class, () -> root.resolvePath("a", "b", "c"));
		assertEquals(2, e.consumed());
	}

	@Test
	void recursion_isBounded() {
		assertTrue(recursion(TEXT_ID).isBounded());
		assertTrue(allOf(DEC_ID, recursion(3)).isBounded());
		assertFalse(anyOf(DEC_ID, recursion(3)).isBounded());
		assertTrue(anyOf(recursion(TEXT_ID), recursion(3)).isBounded());
		assertFalse(not(recursion(3)).isBounded());
		assertFalse(under(SECTION).isBounded());
		assertTrue(under(SECTION, recursion(3)).isBounded());
		assertThrows(IllegalArgumentException.class, () -> recursion(0));
	}

	RouteContext atRoute(String uri, NodeType<?> target, @Nullable String segment) {
		Route parent = tree.routes().stream()
			.filter(r -> r.uri().equals(uri))
			.findFirst()
			.orElseThrow();
		return new RouteContext(parent, target, "k", segment);
	}

	@Test
	void decide_segmentConditions_needTheSegment() {
		assertEquals(Verdict.UNDECIDED, DEC_ID.decide(atRoute("/blog/", PAGE, null)));
		assertEquals(Verdict.UNDECIDED, literal("a").decide(atRoute("/blog/", PAGE, null)));
		assertEquals(Verdict.UNDECIDED, TEXT_ID.decide(atRoute("/blog/", PAGE, null)));
		assertEquals(Verdict.MATCHES, DEC_ID.decide(atRoute("/blog/", PAGE, "12")));
		assertEquals(Verdict.FAILS, DEC_ID.decide(atRoute("/blog/", PAGE, "twelve")));
		assertEquals(Verdict.MATCHES, literal("a").decide(atRoute("/blog/", PAGE, "a")));
		assertEquals(Verdict.FAILS, TEXT_ID.decide(atRoute("/blog/", PAGE, "a b")));
	}

	@Test
	void decide_under_usesTypesAndStaticNamesOfTheRoute() {
		assertEquals(Verdict.MATCHES, under(SECTION).decide(atRoute("/blog/", PAGE, null)));
		assertEquals(Verdict.MATCHES, under(SITE).decide(atRoute("/", SECTION, "blog")));
		assertEquals(Verdict.FAILS, under(PAGE).decide(atRoute("/blog/", PAGE, null)));
		assertEquals(Verdict.MATCHES, underNamed("blog").decide(atRoute("/blog/{slug}/", PAGE, null)));
		assertEquals(Verdict.FAILS, underNamed("blog").decide(atRoute("/wiki/{slug}/", PAGE, null)));
		assertEquals(Verdict.UNDECIDED, under(SECTION, DEC_ID).decide(atRoute("/blog/", PAGE, null)));
		assertEquals(Verdict.FAILS, under(PAGE, DEC_ID).decide(atRoute("/blog/", PAGE, null)));
	}

	@Test
	void decide_combinators() {
		RouteContext wiki = atRoute("/wiki/", PAGE, null);
		assertEquals(Verdict.MATCHES, not(underNamed("blog")).decide(wiki));
		assertEquals(Verdict.UNDECIDED, not(DEC_ID).decide(wiki));
		assertEquals(Verdict.FAILS, allOf(DEC_ID, underNamed("blog")).decide(wiki));
		assertEquals(Verdict.UNDECIDED, allOf(DEC_ID, underNamed("wiki")).decide(wiki));
		assertEquals(Verdict.MATCHES, allOf(under(SITE), underNamed("wiki")).decide(wiki));
		assertEquals(Verdict.MATCHES, anyOf(DEC_ID, underNamed("wiki")).decide(wiki));
		assertEquals(Verdict.UNDECIDED, anyOf(DEC_ID, underNamed("blog")).decide(wiki));
		assertEquals(Verdict.FAILS, anyOf(under(PAGE), underNamed("blog")).decide(wiki));
	}

	@Test
	void decide_recursion_countsTargetTypesOnTheRoute() {
		assertEquals(Verdict.UNDECIDED, recursion(TEXT_ID, 2).decide(atRoute("/blog/{slug}/", PAGE, null)));
		assertEquals(Verdict.FAILS, recursion(TEXT_ID, 1).decide(atRoute("/blog/{slug}/", PAGE, null)));
		assertEquals(Verdict.MATCHES, recursion(1).decide(atRoute("/blog/", PAGE, "x")));
	}

	public static class Folder extends Resource { }
}
