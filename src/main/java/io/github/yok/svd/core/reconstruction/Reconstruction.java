package io.github.yok.svd.core.reconstruction;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 打ち切り再構成の結果です。
 */
@Value
public class Reconstruction {

    /**
     * 再構成した行列です（各要素は [0, 255] の整数値）。
     */
    DMatrixRMaj matrix;

    /**
     * 実際に使用した成分数です。
     */
    int usedComponents;

    /**
     * 使用可能だった成分数（特異値の数）です。
     */
    int availableComponents;
}
