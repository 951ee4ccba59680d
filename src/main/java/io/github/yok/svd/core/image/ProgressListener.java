package io.github.yok.svd.core.image;

/**
 * 圧縮処理の進捗を受け取るリスナです。
 *
 * <p>
 * 呼び出しは処理を調停するスレッドからのみ行われます。 通知は観測専用であり、処理の流れには影響しません。
 * </p>
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * 何もしないリスナです。
     */
    ProgressListener NONE = (percent, stage, message) -> {
    };

    /**
     * 進捗を通知します。
     *
     * @param percent 進捗率（0〜100）です
     * @param stage チェックポイントです
     * @param message 表示用メッセージです
     */
    void onProgress(int percent, ProgressStage stage, String message);
}
