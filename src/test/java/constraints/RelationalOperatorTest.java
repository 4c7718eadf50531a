/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package constraints;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import dashboard.DiagnosticKind;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

public class RelationalOperatorTest {

    @ParameterizedTest
    @CsvSource({ "≤,<=", "≥,>=", "=,==", "<,<", ">,>", "≠,!=" })
    void canonicalizesEachSymbol(String symbol, String tag) {
        RelationalOperator op = RelationalOperator.canonicalize(symbol);
        assertThat(op.tag()).isEqualTo(tag);
        assertThat(RelationalOperator.ofTag(tag)).isSameAs(op);
        assertThat(op.symbol()).isEqualTo(symbol);
    }

    @Test
    void mappingIsABijection() {
        Set<String> symbols = Arrays.stream(RelationalOperator.values()).map(RelationalOperator::symbol).collect(Collectors.toSet());
        Set<String> tags = Arrays.stream(RelationalOperator.values()).map(RelationalOperator::tag).collect(Collectors.toSet());
        assertThat(symbols).hasSize(6);
        assertThat(tags).hasSize(6);
    }

    @Test
    void ignoresSurroundingWhitespace() {
        assertThat(RelationalOperator.canonicalize(" ≤ ")).isEqualTo(RelationalOperator.LE);
    }

    @Test
    void rejectsOtherSymbols() {
        assertThatThrownBy(() -> RelationalOperator.canonicalize("=>")).isInstanceOf(OperatorException.class)
                .satisfies(e -> assertThat(((OperatorException) e).getKind()).isEqualTo(DiagnosticKind.OPERATOR));
        assertThatThrownBy(() -> RelationalOperator.canonicalize(null)).isInstanceOf(OperatorException.class);
        assertThatThrownBy(() -> RelationalOperator.ofTag("=<")).isInstanceOf(OperatorException.class);
    }

    @Test
    void onlyLessAndGreaterAreStrict() {
        assertThat(Arrays.stream(RelationalOperator.values()).filter(RelationalOperator::isStrict)).containsExactlyInAnyOrder(RelationalOperator.LT,
                RelationalOperator.GT);
    }

    @Property
    void symbolRoundTrip(@ForAll("operators") RelationalOperator op) {
        assertThat(RelationalOperator.canonicalize(op.symbol())).isSameAs(op);
        assertThat(RelationalOperator.ofTag(op.tag())).isSameAs(op);
    }

    @Property
    void anythingElseIsRejected(@ForAll String symbol) {
        boolean known = Arrays.stream(RelationalOperator.values()).anyMatch(op -> op.symbol().equals(symbol.strip()));
        if (known)
            assertThat(RelationalOperator.canonicalize(symbol).symbol()).isEqualTo(symbol.strip());
        else
            assertThatThrownBy(() -> RelationalOperator.canonicalize(symbol)).isInstanceOf(OperatorException.class);
    }

    @Provide
    Arbitrary<RelationalOperator> operators() {
        return Arbitraries.of(RelationalOperator.class);
    }
}
