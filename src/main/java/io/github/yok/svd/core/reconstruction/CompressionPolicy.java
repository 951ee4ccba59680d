package io.github.yok.svd.core.reconstruction;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import lombok.Value;

/**
 * 打ち切り方式と保持割合の組です。
 *
 * <p>
 * {@code ByCount(percent)} は {@link CompressionMethod#COUNT}、{@code ByEnergy(percent)} は
 * {@link CompressionMethod#SUM} に対応します。 percent は [0, 1] の割合です。
 * </p>
 */
@Value
public class CompressionPolicy {

    /**
     * 打ち切り方式です。
     */
    CompressionMethod method;

    /**
     * 保持割合（0 以上 1 以下）です。
     */
    double percent;

    /**
     * ポリシーを生成します。
     *
     * @param method 打ち切り方式です（null 不可）
     * @param percent 保持割合です（0 以上 1 以下）
     * @throws IllegalArgumentException percent が範囲外の場合に発生します
     */
    public CompressionPolicy(CompressionMethod method, double percent) {
        this.method = checkNotNull(method, "method は null 不可です");
        checkArgument(percent >= 0.0 && percent <= 1.0, "percent は [0, 1] が必要です: %s", percent);
        this.percent = percent;
    }

    /**
     * 個数割合のポリシーを返します。
     *
     * @param percent 保持割合です
     * @return ポリシーです
     */
    public static CompressionPolicy byCount(double percent) {
        return new CompressionPolicy(CompressionMethod.COUNT, percent);
    }

    /**
     * 累積和割合のポリシーを返します。
     *
     * @param percent 保持割合です
     * @return ポリシーです
     */
    public static CompressionPolicy byEnergy(double percent) {
        return new CompressionPolicy(CompressionMethod.SUM, percent);
    }

    /**
     * 百分率（0〜100）からポリシーを返します。
     *
     * @param method 打ち切り方式です
     * @param percentage 百分率です
     * @return {@code percentage / 100} を保持割合とするポリシーです
     */
    public static CompressionPolicy ofPercentage(CompressionMethod method, int percentage) {
        checkArgument(percentage >= 0 && percentage <= 100, "百分率は [0, 100] が必要です: %s",
                percentage);
        return new CompressionPolicy(method, percentage / 100.0);
    }
}
