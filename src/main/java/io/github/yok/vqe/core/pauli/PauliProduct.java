package io.github.yok.vqe.core.pauli;

import lombok.Value;
import org.apache.commons.math3.complex.Complex;

/**
 * 2 つの Pauli 文字列の積 {@code i^phase · term} を表すクラスです。
 */
@Value
public class PauliProduct {

    /**
     * 積のビットパターン（Z, X それぞれの XOR）です。
     */
    PauliTerm term;

    /**
     * 積に掛かる大域位相を i のべき指数（0..3）で表したものです。
     */
    int phase;

    /**
     * 大域位相を複素数として返します。
     *
     * @return {@code i^phase} です
     */
    public Complex phaseFactor() {
        return PauliAlgebra.timesIPower(Complex.ONE, phase);
    }
}
