package io.vena.thicket;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static io.vena.thicket.AbstractEntityTest.AGE;
import static io.vena.thicket.AbstractEntityTest.EMAIL;
import static io.vena.thicket.AbstractEntityTest.ROLE;
import static io.vena.thicket.AbstractEntityTest.USERNAME;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultSchemaEvaluatorTest {
	final DefaultSchemaEvaluator evaluator = new DefaultSchemaEvaluator();

	static Stream<Arguments> cases() {
		Constraints exclusive = Constraints.builder().exclusiveMinimum(0).exclusiveMaximum(1).build();
		Constraints tags = Constraints.builder().type(ValueType.LIST).minLength(1).maxLength(2).build();
		return Stream.of(
			Arguments.of(USERNAME, "abc", true),
			Arguments.of(USERNAME, "ab", false),
			Arguments.of(USERNAME, "abcdefghijklmnopqrstu", false),
			Arguments.of(USERNAME, 123, false),
			Arguments.of(AGE, 0, true),
			Arguments.of(AGE, 150, true),
			Arguments.of(AGE, 151, false),
			Arguments.of(AGE, -1, false),
			Arguments.of(AGE, 30L, true),
			Arguments.of(AGE, 30.5, false),
			Arguments.of(EMAIL, "a@b.example", true),
			Arguments.of(EMAIL, "not an email", false),
			Arguments.of(ROLE, "admin", true),
			Arguments.of(ROLE, "root", false),
			Arguments.of(exclusive, 0.5, true),
			Arguments.of(exclusive, 0, false),
			Arguments.of(exclusive, 1, false),
			Arguments.of(exclusive, new BigDecimal("0.999"), true),
			Arguments.of(tags, List.of("a"), true),
			Arguments.of(tags, List.of(), false),
			Arguments.of(tags, List.of("a", "b", "c"), false),
			Arguments.of(tags, Map.of("a", 1), false),
			Arguments.of(Constraints.none(), new Object(), true)
		);
	}

	@ParameterizedTest
	@MethodSource("cases")
	void evaluate(Constraints constraints, Object value, boolean expected) {
		assertEquals(expected, evaluator.evaluate(value, constraints).ok(), () -> value + " against " + constraints);
	}

	@Test
	void null_passesUnlessRequired() {
		assertTrue(evaluator.evaluate(null, USERNAME).ok());
		assertTrue(evaluator.evaluate(null, AGE).ok());
		assertFalse(evaluator.evaluate(null, Constraints.builder().required(true).build()).ok());
	}

	@Test
	void failure_hasDetail() {
		Evaluation evaluation = evaluator.evaluate("ab", USERNAME);
		assertFalse(evaluation.ok());
		assertThat(evaluation.detail(), containsString("less than 3"));
	}

	@Test
	void evaluateAll_checksRequiredFields() {
		FieldTable table = FieldTable.of("User", List.of(
			FieldSpec.of("username", USERNAME),
			FieldSpec.of("age", AGE)));
		assertTrue(evaluator.evaluateAll(Map.of("username", "abc", "age", 30), table));
		assertTrue(evaluator.evaluateAll(Map.of("username", "abc"), table));
		assertFalse(evaluator.evaluateAll(Map.of("age", 30), table));
		assertFalse(evaluator.evaluateAll(Map.of("username", "abc", "age", 200), table));
	}
}
