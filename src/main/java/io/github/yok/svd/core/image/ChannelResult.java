package io.github.yok.svd.core.image;

import io.github.yok.svd.core.reconstruction.Reconstruction;
import io.github.yok.svd.core.svd.SvdResult;
import lombok.Value;

/**
 * 1チャネル分の分解・再構成結果です。
 */
@Value
public class ChannelResult {

    /**
     * チャネルです。
     */
    Channel channel;

    /**
     * 特異値分解の結果です。
     */
    SvdResult svd;

    /**
     * 再構成結果です。
     */
    Reconstruction reconstruction;

    /**
     * 使用した成分数を返します。
     *
     * @return 成分数です
     */
    public int usedComponents() {
        return reconstruction.getUsedComponents();
    }

    /**
     * 特異値の総数を返します。
     *
     * @return 特異値の数です
     */
    public int totalComponents() {
        return svd.rank();
    }
}
