package org.pragmatica.expr;

import org.junit.jupiter.api.Test;
import org.pragmatica.expr.error.ExpressionError;
import org.pragmatica.expr.error.ExpressionError.EvaluationError;

import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    private static final ExpressionError ERROR = new EvaluationError.UnknownFunction("f");

    @Test
    void success_mapsAndUnwraps() {
        var result = Result.success(20).map(value -> value + 1);

        assertTrue(result.isSuccess());
        assertEquals(21, result.unwrap());
        assertThrows(IllegalStateException.class, result::error);
    }

    @Test
    void failure_skipsMappersAndKeepsError() {
        Result<Integer> failed = Result.failure(ERROR);

        var result = failed.map(value -> value + 1)
                           .flatMap(value -> Result.success(value * 2));

        assertTrue(result.isFailure());
        assertSame(ERROR, result.error());
        assertThrows(IllegalStateException.class, result::unwrap);
    }

    @Test
    void flatMap_propagatesInnerFailure() {
        var result = Result.success(1).flatMap(value -> Result.<Integer>failure(ERROR));

        assertSame(ERROR, result.error());
    }

    @Test
    void fold_selectsBranch() {
        assertEquals("ok 3", Result.success(3).fold(ExpressionError::message, value -> "ok " + value));
        assertEquals("Unknown function: f", Result.failure(ERROR).fold(ExpressionError::message, value -> "ok"));
    }

    @Test
    void onSuccessAndOnFailure_runOnlyMatchingAction() {
        var seen = new ArrayList<String>();

        Result.success(1)
              .onSuccess(value -> seen.add("success " + value))
              .onFailure(error -> seen.add("failure"));
        Result.failure(ERROR)
              .onSuccess(value -> seen.add("success"))
              .onFailure(error -> seen.add("failure " + error.code()));

        assertEquals(java.util.List.of("success 1", "failure E0202"), seen);
    }

    @Test
    void failure_rejectsNullError() {
        assertThrows(NullPointerException.class, () -> Result.failure(null));
    }
}
