package com.forum.domain.model;

import com.forum.domain.error.ValidationError.UserIdError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UserId")
class UserIdTest {

    @Nested
    @DisplayName("parse")
    class ParseTests {

        @Test
        @DisplayName("Should parse a positive integer")
        void shouldParsePositiveInteger() {
            var result = UserId.parse("42");

            assertTrue(result.isSuccess());
            assertEquals(42L, result.getOrThrow().value());
        }

        @Test
        @DisplayName("Should trim surrounding whitespace")
        void shouldTrimWhitespace() {
            assertEquals(UserId.of(7), UserId.parse(" 7 ").getOrThrow());
        }

        @Test
        @DisplayName("Should fail with Empty for null or blank input")
        void shouldFailWithEmpty() {
            assertInstanceOf(UserIdError.Empty.class, UserId.parse(null).errorOrNull());
            assertInstanceOf(UserIdError.Empty.class, UserId.parse("   ").errorOrNull());
        }

        @ParameterizedTest
        @ValueSource(strings = {"abc", "1.5", "12abc", "0x10", "99999999999999999999"})
        @DisplayName("Should fail with InvalidFormat for non-integers")
        void shouldFailWithInvalidFormat(String value) {
            var result = UserId.parse(value);

            assertTrue(result.isFailure());
            assertInstanceOf(UserIdError.InvalidFormat.class, result.errorOrNull());
            assertEquals("USER_ID_INVALID_FORMAT", result.errorOrNull().code());
        }

        @ParameterizedTest
        @ValueSource(strings = {"0", "-1", "-500"})
        @DisplayName("Should fail with NotPositive for zero and negatives")
        void shouldFailWithNotPositive(String value) {
            var result = UserId.parse(value);

            assertTrue(result.isFailure());
            assertInstanceOf(UserIdError.NotPositive.class, result.errorOrNull());
        }
    }

    @Nested
    @DisplayName("fromTrusted")
    class FromTrustedTests {

        @Test
        @DisplayName("Should accept positive values")
        void shouldAcceptPositive() {
            assertEquals("3", UserId.fromTrusted(3).toString());
        }

        @Test
        @DisplayName("Should throw on corrupted values")
        void shouldThrowOnCorruptedValue() {
            assertThrows(IllegalStateException.class, () -> UserId.fromTrusted(0));
        }
    }
}
