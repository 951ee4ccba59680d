package io.github.yok.svd.core.reconstruction;

import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 特異値の打ち切り方式です。
 */
@Getter
@RequiredArgsConstructor
public enum CompressionMethod {

    /**
     * 特異値の個数に対する割合で打ち切ります。
     */
    COUNT("count"),

    /**
     * 特異値の総和に対する累積割合で打ち切ります。
     */
    SUM("sum");

    /**
     * 出力ファイル名などに使うラベルです。
     */
    private final String label;

    /**
     * ラベル（count / sum、大文字小文字は区別しません）から方式を返します。
     *
     * @param label ラベルです
     * @return 方式です
     * @throws IllegalArgumentException 未知のラベルの場合に発生します
     */
    public static CompressionMethod fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (CompressionMethod m : values()) {
                if (m.label.equals(normalized)) {
                    return m;
                }
            }
        }
        throw new IllegalArgumentException("未知の圧縮方式です（count / sum）: " + label);
    }
}
