package qudit.controls;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import qudit.core.ValidationException;

final class SumOfProductsTest {

  private static final SumOfProducts XOR =
      SumOfProducts.of(List.of(List.of(0, 1), List.of(1, 0)), "xor");

  @Test
  void termsMustHaveEqualLength() {
    ValidationException e =
        assertThrows(
            ValidationException.class,
            () -> SumOfProducts.of(List.of(List.of(0, 1), List.of(1))));
    assertTrue(e.getMessage().contains("Size of all product terms must be equal"));
  }

  @Test
  void termsAreSortedAndDeduplicated() {
    SumOfProducts values =
        SumOfProducts.of(List.of(List.of(1, 0), List.of(0, 1), List.of(1, 0)));
    assertEquals(List.of(List.of(0, 1), List.of(1, 0)), values.conjunctions());
    assertEquals(2, values.numQudits());
  }

  @Test
  void equalityIgnoresNameAndOrder() {
    SumOfProducts unnamed = SumOfProducts.of(List.of(List.of(1, 0), List.of(0, 1)));
    assertEquals(XOR, unnamed);
    assertEquals(XOR.hashCode(), unnamed.hashCode());
  }

  @Test
  void matchesIsDisjunctionOfExactTuples() {
    assertTrue(XOR.matches(List.of(0, 1)));
    assertTrue(XOR.matches(List.of(1, 0)));
    assertFalse(XOR.matches(List.of(1, 1)));
    assertFalse(XOR.matches(List.of(0, 0)));
  }

  @Test
  void validateRejectsOutOfRange() {
    SumOfProducts values = SumOfProducts.of(List.of(List.of(0, 2)));
    ValidationException e =
        assertThrows(ValidationException.class, () -> values.validate(List.of(2, 2)));
    assertTrue(e.getMessage().contains("outside of range"), e.getMessage());
    values.validate(List.of(2, 3));
  }

  @Test
  void asProductOfSumsOnlyForCartesianSets() {
    SumOfProducts cube = SumOfProducts.of(List.of(List.of(0, 1), List.of(1, 1)));
    assertEquals(
        Optional.of(ProductOfSums.of(List.of(Set.of(0, 1), Set.of(1)))), cube.asProductOfSums());
    assertTrue(XOR.asProductOfSums().isEmpty());
  }

  @Test
  void diagramLabels() {
    assertEquals(List.of("@", "@(xor)"), XOR.diagramLabels(List.of(2, 2)));
    SumOfProducts unnamed = SumOfProducts.of(List.of(List.of(0, 1), List.of(1, 0)));
    assertEquals(List.of("@(01)", "@(10)"), unnamed.diagramLabels(List.of(2, 2)));
  }

  @Test
  void textForms() {
    assertEquals("C_xor", XOR.toString());
    assertEquals(
        "C_01_10", SumOfProducts.of(List.of(List.of(1, 0), List.of(0, 1))).toString());
    assertEquals("SumOfProducts([[0, 1], [1, 0]], name=\"xor\")", XOR.repr());
    assertEquals(
        "SumOfProducts([[0, 1]])", SumOfProducts.of(List.of(List.of(0, 1))).repr());
  }
}
