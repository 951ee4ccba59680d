package io.github.yok.svd.core.image;

import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 画像の種類と、その種類で処理するチャネルの並びです。
 */
@Getter
@RequiredArgsConstructor
public enum ImageType {

    /**
     * グレースケール画像です（1チャネル）。
     */
    GRAYSCALE("grayscale", List.of(Channel.GRAY)),

    /**
     * カラー画像です（R→G→B の3チャネル）。
     */
    RGB("rgb", List.of(Channel.RED, Channel.GREEN, Channel.BLUE));

    /**
     * 表示用のラベルです。
     */
    private final String label;

    /**
     * 処理順のチャネル一覧です。
     */
    private final List<Channel> channels;
}
