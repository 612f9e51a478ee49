package com.hsbc.timed.outcome;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OutcomeClassifier Tests")
class OutcomeClassifierTest {

    @Test
    @DisplayName("Null and empty Optional classify as NULL")
    void shouldClassifyAbsentValuesAsNull() {
        assertThat(OutcomeClassifier.classify(null).getKind()).isEqualTo(OutcomeKind.NULL);
        assertThat(OutcomeClassifier.classify(Optional.empty()).getKind()).isEqualTo(OutcomeKind.NULL);
    }

    @Test
    @DisplayName("Containers without elements classify as EMPTY")
    void shouldClassifyEmptyContainersAsEmpty() {
        assertThat(OutcomeClassifier.classify(List.of()).getKind()).isEqualTo(OutcomeKind.EMPTY);
        assertThat(OutcomeClassifier.classify(Map.of()).getKind()).isEqualTo(OutcomeKind.EMPTY);
        assertThat(OutcomeClassifier.classify(new ArrayDeque<>()).getKind()).isEqualTo(OutcomeKind.EMPTY);
        assertThat(OutcomeClassifier.classify(new int[0]).getKind()).isEqualTo(OutcomeKind.EMPTY);
    }

    @Test
    @DisplayName("A plain Iterable is passed through untouched as SUCCESS")
    void shouldNotConsumeSingleUseIterables() {
        AtomicInteger iterations = new AtomicInteger();
        Iterable<String> once = () -> {
            iterations.incrementAndGet();
            return Collections.emptyIterator();
        };

        Outcome<Iterable<String>> outcome = OutcomeClassifier.classify(once);

        assertThat(outcome.getKind()).isEqualTo(OutcomeKind.SUCCESS);
        assertThat(outcome.getValue()).isSameAs(once);
        assertThat(iterations).hasValue(0);
    }

    @Test
    @DisplayName("Everything else classifies as SUCCESS with the value")
    void shouldClassifyValuesAsSuccess() {
        assertThat(OutcomeClassifier.classify(42)).isEqualTo(Outcome.success(42));
        assertThat(OutcomeClassifier.classify(List.of("a")).getValue()).containsExactly("a");
        assertThat(OutcomeClassifier.classify(Optional.of("x")).isSuccess()).isTrue();
        assertThat(OutcomeClassifier.classify("").getKind()).isEqualTo(OutcomeKind.SUCCESS);
        assertThat(OutcomeClassifier.classify(new String[] {"a"}).getKind()).isEqualTo(OutcomeKind.SUCCESS);
    }

    @Test
    @DisplayName("Failures are unwrapped from future wrappers")
    void shouldUnwrapFutureWrappers() {
        IOException root = new IOException("down");

        Outcome<Object> outcome = OutcomeClassifier.classifyFailure(
                new CompletionException(new ExecutionException(root)));

        assertThat(outcome.getKind()).isEqualTo(OutcomeKind.ERROR);
        assertThat(outcome.getCause()).isSameAs(root);
    }

    @Test
    @DisplayName("A wrapper without a cause is kept as is")
    void shouldKeepWrapperWithoutCause() {
        CompletionException bare = new CompletionException("bare", null);

        assertThat(OutcomeClassifier.classifyFailure(bare).getCause()).isSameAs(bare);
    }
}
