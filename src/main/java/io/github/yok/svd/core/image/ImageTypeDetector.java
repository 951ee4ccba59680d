package io.github.yok.svd.core.image;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 画像がグレースケールかカラーかを判定するクラスです。
 */
public final class ImageTypeDetector {

    /**
     * すべての画素で R=G=B であればグレースケール、それ以外はカラーと判定します。
     *
     * @param image 画素バッファです
     * @return 画像の種類です
     */
    public ImageType detect(PixelBuffer image) {
        checkNotNull(image, "image は null 不可です");
        byte[] data = image.getData();
        for (int i = 0; i < data.length; i += PixelBuffer.COMPONENTS) {
            if (data[i] != data[i + 1] || data[i] != data[i + 2]) {
                return ImageType.RGB;
            }
        }
        return ImageType.GRAYSCALE;
    }
}
