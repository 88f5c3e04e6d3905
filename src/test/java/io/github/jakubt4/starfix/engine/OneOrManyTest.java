package io.github.jakubt4.starfix.engine;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OneOrManyTest {

    @Test
    void loneValueFlattensToSingleElementList() {
        final var value = OneOrMany.one(42.0);

        assertThat(value.asList()).containsExactly(42.0);
        assertThat(value).hasToString("42.0");
    }

    @Test
    void loneNullIsKeptAsAnEntry() {
        final OneOrMany<PixelPosition> value = OneOrMany.one(null);

        assertThat(value.asList()).hasSize(1).containsNull();
    }

    @Test
    void listIsCopiedAndUnmodifiable() {
        final var source = new ArrayList<>(List.of(1.0, 2.0));
        final var value = OneOrMany.many(source);
        source.add(3.0);

        assertThat(value.asList()).containsExactly(1.0, 2.0);
        assertThat(value).hasToString("[1.0, 2.0]");
        assertThatThrownBy(() -> value.asList().add(4.0)).isInstanceOf(UnsupportedOperationException.class);
    }
}
