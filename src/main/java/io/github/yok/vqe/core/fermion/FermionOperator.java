package io.github.yok.vqe.core.fermion;

import io.github.yok.vqe.core.pauli.PauliSum;
import lombok.Value;

/**
 * 1 つの軌道に対する生成・消滅演算子の Jordan-Wigner 像を保持するクラスです。
 *
 * <p>
 * 演算子はちょうど 2 項の Pauli 和です。必要になるたびに生成し直し、変更はしません。
 * </p>
 */
@Value
public class FermionOperator {

    /**
     * 演算子の種類です。
     */
    public enum Kind {
        /**
         * 消滅演算子 a_i です。
         */
        ANNIHILATION,

        /**
         * 生成演算子 a_i† です。
         */
        CREATION
    }

    /**
     * 軌道インデックスです。
     */
    int orbital;

    /**
     * 演算子の種類です。
     */
    Kind kind;

    /**
     * Pauli 和としての演算子です。
     */
    PauliSum operator;
}
