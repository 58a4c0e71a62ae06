package com.ryuqq.kernel.core.result;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Result Sealed Interface 테스트.
 *
 * @author Kernel Team
 * @since 1.0.0
 */
class ResultTest {

    @Test
    void success_IsSuccess_ReturnsTrue() {
        // Given
        Result<String> result = Result.success("Jane Doe");

        // When & Then
        assertTrue(result.isSuccess());
        assertFalse(result.isFailure());
        assertEquals("Jane Doe", result.value());
    }

    @Test
    void fail_IsFailure_ReturnsTrue() {
        // Given
        Result<String> result = Result.fail("Invalid value");

        // When & Then
        assertFalse(result.isSuccess());
        assertTrue(result.isFailure());
        assertEquals("Invalid value", result.error());
    }

    @Test
    void value_OnFailure_ThrowsIllegalState() {
        // Given
        Result<Integer> result = Result.fail("Invalid value");

        // When & Then
        IllegalStateException exception = assertThrows(IllegalStateException.class, result::value);
        assertTrue(exception.getMessage().contains("value accessed on a failure result"));
    }

    @Test
    void error_OnSuccess_ThrowsIllegalState() {
        // Given
        Result<Integer> result = Result.success(21);

        // When & Then
        IllegalStateException exception = assertThrows(IllegalStateException.class, result::error);
        assertEquals("error accessed on a success result", exception.getMessage());
    }

    @Test
    void fail_BlankMessage_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Result.fail(null));
        assertThrows(IllegalArgumentException.class, () -> Result.fail("   "));
    }

    @Test
    void ok_IsSuccessWithoutPayload() {
        // When
        Result<Void> result = Result.ok();

        // Then
        assertTrue(result.isSuccess());
        assertNull(result.value());
    }

    @Test
    void instanceofCheck_WorksCorrectly() {
        // Given
        Result<Integer> success = Result.success(1);
        Result<Integer> failure = Result.fail("error");

        // When & Then
        assertTrue(success instanceof Success);
        assertFalse(success instanceof Failure);
        assertTrue(failure instanceof Failure);
        assertFalse(failure instanceof Success);
    }

    @Test
    void map_OnSuccess_TransformsValue() {
        // Given
        Result<Integer> result = Result.success(21);

        // When
        Result<String> mapped = result.map(age -> "age=" + age);

        // Then
        assertTrue(mapped.isSuccess());
        assertEquals("age=21", mapped.value());
    }

    @Test
    void map_OnFailure_KeepsError() {
        // Given
        Result<Integer> result = Result.fail("Invalid value");

        // When
        Result<String> mapped = result.map(age -> {
            throw new AssertionError("mapper must not run on failure");
        });

        // Then
        assertTrue(mapped.isFailure());
        assertEquals("Invalid value", mapped.error());
    }

    @Test
    void flatMap_ChainsValidatedSteps() {
        // Given
        Result<Integer> result = Result.success(200);

        // When
        Result<Integer> chained = result.flatMap(v -> v > 130 ? Result.fail("Too old") : Result.success(v));

        // Then
        assertTrue(chained.isFailure());
        assertEquals("Too old", chained.error());
    }

    @Test
    void combine_AllSuccess_ReturnsOk() {
        // When
        Result<Void> combined = Result.combine(Result.success(1), Result.success("a"), Result.ok());

        // Then
        assertTrue(combined.isSuccess());
    }

    @Test
    void combine_ReturnsFirstFailure() {
        // When
        Result<Void> combined = Result.combine(
            Result.success(1),
            Result.fail("first"),
            Result.fail("second")
        );

        // Then
        assertTrue(combined.isFailure());
        assertEquals("first", combined.error());
    }

    @Test
    void combine_NullElement_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Result.combine(Result.ok(), null));
    }

    @Test
    void orElse_ReturnsFallbackOnFailure() {
        // Given
        Result<Integer> success = Result.success(21);
        Result<Integer> failure = Result.fail("Invalid value");

        // When & Then
        assertEquals(21, success.orElse(0));
        assertEquals(0, failure.orElse(0));
    }

    @Test
    void equals_SamePayload_ReturnsTrue() {
        // When & Then
        assertEquals(Result.success(21), Result.success(21));
        assertEquals(Result.fail("x"), Result.fail("x"));
        assertNotEquals(Result.success("x"), Result.fail("x"));
    }
}
