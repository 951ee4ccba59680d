package io.github.yok.svd.core.image;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 圧縮処理の進捗チェックポイントです。
 */
@Getter
@RequiredArgsConstructor
public enum ProgressStage {

    STARTED(0, "圧縮を開始します"),

    DECOMPOSING(10, "特異値分解を実行しています"),

    EIGEN_SOLVED(50, "固有値分解が完了しました"),

    RECONSTRUCTING(80, "画像を再構成しています"),

    COMPLETED(100, "圧縮が完了しました");

    /**
     * このチェックポイントの進捗率（0〜100）です。
     */
    private final int percent;

    /**
     * 表示用のラベルです。
     */
    private final String label;
}
