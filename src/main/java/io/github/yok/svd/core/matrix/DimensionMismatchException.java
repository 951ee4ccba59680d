package io.github.yok.svd.core.matrix;

/**
 * 行列・ベクトルの次元が演算の前提と一致しない場合に発生する例外です。
 *
 * <p>
 * 空行列や行ごとに長さが異なる（ragged）入力もこの例外で扱います。 圧縮処理全体を中断する致命的なエラーです。
 * </p>
 */
public class DimensionMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public DimensionMismatchException(String message) {
        super(message);
    }
}
