package calendar;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OperationResultTest {

  @Test
  void successCarriesValue() {
    OperationResult<String> result = OperationResult.success("database.personal.abc");

    assertTrue(result.isSuccess());
    assertEquals(Optional.of("database.personal.abc"), result.value());
    assertEquals(Optional.empty(), result.failureReason());
    assertEquals("database.personal.abc", result.orElseThrow());
  }

  @Test
  void doneHasNoValue() {
    OperationResult<Void> result = OperationResult.done();

    assertTrue(result.isSuccess());
    assertEquals(Optional.empty(), result.value());
    assertNull(result.orElseThrow());
  }

  @Test
  void failureThrowsOnOrElseThrow() {
    OperationResult<String> result = OperationResult.failure(FailureReason.NOT_FOUND, "Object not found: a.b.c");

    assertFalse(result.isSuccess());
    assertEquals(Optional.of(FailureReason.NOT_FOUND), result.failureReason());
    FederationOperationException e = assertThrows(FederationOperationException.class, result::orElseThrow);
    assertEquals(FailureReason.NOT_FOUND, e.reason());
    assertTrue(e.getMessage().contains("a.b.c"));
  }

  @Test
  void failureCanBeRetyped() {
    OperationResult<String> result = OperationResult.failure(FailureReason.BACKEND_NOT_FOUND, "missing");

    OperationResult.Failure<Integer> retyped = result.asFailure();

    assertEquals(FailureReason.BACKEND_NOT_FOUND, retyped.reason());
    assertEquals("missing", retyped.message());
  }

  @Test
  void successCannotBeRetypedAsFailure() {
    assertThrows(IllegalStateException.class, () -> OperationResult.success(1).asFailure());
  }

  @Test
  void failureRequiresReason() {
    assertThrows(NullPointerException.class, () -> OperationResult.failure(null, "x"));
  }
}
