package io.github.yok.vqe.input;

import io.github.yok.vqe.core.hamiltonian.MolecularIntegrals;
import java.util.List;

/**
 * 原子間距離ごとの分子積分を供給するインタフェースです。
 */
public interface IntegralSource {

    /**
     * 全距離点の分子積分を読み込み、距離の昇順で返します。
     *
     * @return 分子積分の一覧です
     */
    List<MolecularIntegrals> load();
}
