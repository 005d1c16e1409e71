package io.vena.thicket;

import io.vena.thicket.exceptions.DefinitionException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static io.vena.thicket.AbstractEntityTest.AGE;
import static io.vena.thicket.AbstractEntityTest.ROLE;
import static io.vena.thicket.AbstractEntityTest.USERNAME;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldTableTest {
	@Test
	void preservesDeclarationOrder() {
		FieldTable table = FieldTable.of("User", List.of(
			FieldSpec.of("zeta", USERNAME),
			FieldSpec.of("alpha", AGE),
			FieldSpec.of("mid", ROLE, "user")));
		assertThat(table.names(), contains("zeta", "alpha", "mid"));
		assertThat(table.describe().keySet(), contains("zeta", "alpha", "mid"));
	}

	@Test
	void requiredIffNoDefault() {
		assertTrue(FieldSpec.of("a", Constraints.none()).required());
		assertFalse(FieldSpec.of("a", Constraints.none(), "x").required());
		assertFalse(FieldSpec.of("a", AGE).required(), "Explicit required=false wins");
		assertTrue(FieldSpec.of("a", Constraints.builder().required(true).build(), "x").required(), "Explicit required=true wins");
		assertFalse(FieldSpec.optional("a", USERNAME).required());
	}

	@Test
	void duplicateName_throws() {
		DefinitionException e = assertThrows(DefinitionException.class, () -> FieldTable.of("User", List.of(
			FieldSpec.of("name", USERNAME),
			FieldSpec.of("name", AGE))));
		assertEquals("User", e.entityType());
		assertEquals("name", e.member());
	}

	@ParameterizedTest
	@ValueSource(strings = { "", " ", "a.b", "a[0]", "x]" })
	void malformedName_throws(String name) {
		assertThrows(DefinitionException.class, () -> FieldTable.of("User", List.of(FieldSpec.of(name, USERNAME))));
	}

	@Test
	void invalidPattern_throws() {
		Constraints broken = Constraints.builder().pattern("[unclosed").build();
		assertThrows(DefinitionException.class, () -> FieldTable.of("User", List.of(FieldSpec.of("x", broken))));
	}

	@Test
	@SuppressWarnings("unchecked")
	void describe_includesDefaultsAndConstraints() {
		FieldTable table = FieldTable.of("User", List.of(FieldSpec.of("role", ROLE, "user")));
		Map<String, Object> role = (Map<String, Object>) table.describe().get("role");
		assertEquals("string", role.get("type"));
		assertEquals(List.of("user", "admin"), role.get("enum"));
		assertEquals(false, role.get("required"));
		assertEquals("user", role.get("default"));
	}
}
