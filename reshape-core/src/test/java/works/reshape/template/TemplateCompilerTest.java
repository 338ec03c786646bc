package works.reshape.template;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.reshape.exceptions.DepthExceededException;
import works.reshape.exceptions.NoSpreadTargetException;
import works.reshape.exceptions.TemplateSyntaxException;
import works.reshape.path.PathExpression;
import works.reshape.value.Value;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static works.reshape.TestValues.arr;
import static works.reshape.TestValues.obj;

public class TemplateCompilerTest {
	final TemplateCompiler compiler = new TemplateCompiler(256);

	@Test
	void leaves() {
		MappingNode root = (MappingNode) compiler.compile(obj(
			"path", "/a/b",
			"literal", "'/a/b'",
			"text", "plain text",
			"number", 7,
			"flag", false,
			"nothing", null));
		assertEquals(new PathNode(loc("path"), PathExpression.parse("/a/b")), root.members().get(0).value());
		assertEquals(new LiteralNode(loc("literal"), "/a/b"), root.members().get(1).value());
		assertEquals(new ConstantNode(loc("text"), Value.of("plain text")), root.members().get(2).value());
		assertEquals(new ConstantNode(loc("number"), Value.of(7)), root.members().get(3).value());
		assertEquals(new ConstantNode(loc("flag"), Value.FALSE), root.members().get(4).value());
		assertEquals(new ConstantNode(loc("nothing"), Value.NULL), root.members().get(5).value());
	}

	@Test
	void conversionGathersSpreadsInDocumentOrder() {
		MappingNode root = (MappingNode) compiler.compile(obj(
			"[lines]", obj(
				"...sku", "/skus",
				"fixed", "/account",
				"nested", obj("...qty", "/quantities"))));
		Member lines = root.members().get(0);
		assertEquals("lines", lines.name());
		assertFalse(lines.isBound());
		ConversionNode conversion = (ConversionNode) lines.value();
		assertThat(conversion.spreadSources().stream().map(SpreadSource::location).toList(), contains(
			loc("[lines]", "...sku"),
			loc("[lines]", "nested", "...qty")));

		Member sku = conversion.body().members().get(0);
		assertEquals("sku", sku.name());
		assertEquals(0, sku.spreadSlot());
		assertFalse(conversion.body().members().get(1).isBound());
		Member qty = ((MappingNode) conversion.body().members().get(2).value()).members().get(0);
		assertEquals(1, qty.spreadSlot());
	}

	@Test
	void spreadBelongsToNearestConversion() {
		MappingNode root = (MappingNode) compiler.compile(obj(
			"[outer]", obj(
				"...a", "/as",
				"[inner]", obj("...b", "/bs"))));
		ConversionNode outer = (ConversionNode) root.members().get(0).value();
		assertEquals(1, outer.spreadSources().size());
		ConversionNode inner = (ConversionNode) outer.body().members().get(1).value();
		assertThat(inner.spreadSources().stream().map(SpreadSource::location).toList(), contains(
			loc("[outer]", "[inner]", "...b")));
	}

	@Test
	void spreadConversionFeedsEnclosingConversion() {
		MappingNode root = (MappingNode) compiler.compile(obj(
			"[outer]", obj(
				"...[inner]", obj("...b", "/bs"))));
		ConversionNode outer = (ConversionNode) root.members().get(0).value();
		Member inner = outer.body().members().get(0);
		assertEquals("inner", inner.name());
		assertEquals(0, inner.spreadSlot());
		assertThat(outer.spreadSources().get(0).node(), instanceOf(ConversionNode.class));
	}

	@Test
	void spreadInsideSequenceElement() {
		MappingNode root = (MappingNode) compiler.compile(obj(
			"[rows]", obj("cells", arr(obj("...v", "/vs")))));
		ConversionNode rows = (ConversionNode) root.members().get(0).value();
		assertEquals(loc("[rows]", "cells").element(0).member("...v"), rows.spreadSources().get(0).location());
	}

	@Test
	void spreadOutsideConversionIsPlain() {
		MappingNode root = (MappingNode) compiler.compile(obj("...ids", "/ids"));
		Member ids = root.members().get(0);
		assertEquals("ids", ids.name());
		assertFalse(ids.isBound());
		assertEquals(new PathNode(loc("...ids"), PathExpression.parse("/ids")), ids.value());
	}

	@Test
	void conversionWithoutSpread() {
		NoSpreadTargetException e = assertThrows(NoSpreadTargetException.class, () -> compiler.compile(obj(
			"[order]", obj("account_id", "/retailer/id"))));
		assertEquals(loc("[order]"), e.location());
	}

	@Test
	void spreadInNestedConversionDoesNotSatisfyOuter() {
		NoSpreadTargetException e = assertThrows(NoSpreadTargetException.class, () -> compiler.compile(obj(
			"[outer]", obj("[inner]", obj("...b", "/bs")))));
		assertEquals(loc("[outer]"), e.location());
	}

	static Stream<Arguments> malformedTemplates() {
		return Stream.of(
			arguments(obj("[order", obj("...a", "/a")), "unterminated"),
			arguments(obj("[]", obj("...a", "/a")), "needs a name"),
			arguments(obj("...", "/a"), "needs a name"),
			arguments(obj("[order]", "/orders"), "requires an object"),
			arguments(obj("[order]", arr(obj("...a", "/a"))), "requires an object"),
			arguments(obj("ids", "/a", "...ids", "/b"), "already produced"),
			arguments(obj("[x]", obj("...a", "/a"), "x", 1), "already produced")
		);
	}

	@ParameterizedTest
	@MethodSource("malformedTemplates")
	void malformed(Value template, String expectedMessage) {
		TemplateSyntaxException e = assertThrows(TemplateSyntaxException.class, () -> compiler.compile(template));
		assertThat(e.getMessage(), containsString(expectedMessage));
		assertTrue(e.location().depth() >= 1);
	}

	@Test
	void depthLimit() {
		Value deep = obj("a", obj("b", obj("c", obj("d", "/x"))));
		assertThrows(DepthExceededException.class, () -> new TemplateCompiler(3).compile(deep));
		new TemplateCompiler(4).compile(deep);
	}

	@Test
	void invalidDepthLimit() {
		assertThrows(IllegalArgumentException.class, () -> new TemplateCompiler(0));
	}

	static TemplateLocation loc(String... rawKeys) {
		TemplateLocation result = TemplateLocation.ROOT;
		for (String key: rawKeys) {
			result = result.member(key);
		}
		return result;
	}
}
