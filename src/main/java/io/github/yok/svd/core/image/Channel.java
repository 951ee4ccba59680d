package io.github.yok.svd.core.image;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 圧縮対象のチャネルです。
 *
 * <p>
 * グレースケール画像は赤成分を輝度として扱います（R=G=B の画像のみが対象です）。
 * </p>
 */
@Getter
@RequiredArgsConstructor
public enum Channel {

    GRAY("gray", 0),

    RED("r", 0),

    GREEN("g", 1),

    BLUE("b", 2);

    /**
     * 出力ファイル名などに使うラベルです。
     */
    private final String label;

    /**
     * 画素内の成分オフセットです。
     */
    private final int offset;
}
