package io.github.yok.svd.core.matrix;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 行優先の密行列（{@link DMatrixRMaj}）に対する基本演算をまとめたクラスです。
 *
 * <p>
 * 固有値ソルバと SVD はこのクラスの演算のみを使用します。 すべてのメソッドは引数を変更せず、新しい行列・ベクトルを返します。
 * </p>
 */
public final class MatrixOps {

    private MatrixOps() {}

    /**
     * 転置行列を返します。
     *
     * @param a 対象行列です
     * @return a の転置です
     * @throws IllegalArgumentException a が null の場合に発生します
     */
    public static DMatrixRMaj transpose(DMatrixRMaj a) {
        requireMatrix(a, "a");
        return CommonOps_DDRM.transpose(a, new DMatrixRMaj(a.numCols, a.numRows));
    }

    /**
     * 行列積 A·B を返します。
     *
     * @param a 左側の行列です
     * @param b 右側の行列です
     * @return A·B です
     * @throws DimensionMismatchException A の列数と B の行数が一致しない場合に発生します
     */
    public static DMatrixRMaj multiply(DMatrixRMaj a, DMatrixRMaj b) {
        requireMatrix(a, "a");
        requireMatrix(b, "b");
        if (a.numCols != b.numRows) {
            throw new DimensionMismatchException("行列積の次元が一致しません: A=" + shape(a) + ", B=" + shape(b));
        }
        DMatrixRMaj c = new DMatrixRMaj(a.numRows, b.numCols);
        CommonOps_DDRM.mult(a, b, c);
        return c;
    }

    /**
     * 行列とベクトルの積 A·v を返します。
     *
     * @param a 行列です
     * @param v ベクトルです（長さは A の列数）
     * @return 長さが A の行数のベクトルです
     * @throws DimensionMismatchException A の列数と v の長さが一致しない場合に発生します
     */
    public static double[] multiplyVector(DMatrixRMaj a, double[] v) {
        requireMatrix(a, "a");
        if (v == null) {
            throw new IllegalArgumentException("v は null 不可です");
        }
        if (a.numCols != v.length) {
            throw new DimensionMismatchException(
                    "行列とベクトルの次元が一致しません: A=" + shape(a) + ", len(v)=" + v.length);
        }
        DMatrixRMaj out = new DMatrixRMaj(a.numRows, 1);
        CommonOps_DDRM.mult(a, DMatrixRMaj.wrap(v.length, 1, v), out);
        return out.data;
    }

    /**
     * 2次元配列から行列を生成します。
     *
     * @param rows 行ごとの値です（すべての行は同じ長さである必要があります）
     * @return 値をコピーした行列です
     * @throws DimensionMismatchException 空、または行の長さが揃っていない場合に発生します
     */
    public static DMatrixRMaj fromRows(double[][] rows) {
        if (rows == null || rows.length == 0) {
            throw new DimensionMismatchException("行列が空です");
        }
        if (rows[0] == null || rows[0].length == 0) {
            throw new DimensionMismatchException("行列の列数が 0 です");
        }
        int cols = rows[0].length;
        for (int i = 1; i < rows.length; i++) {
            if (rows[i] == null || rows[i].length != cols) {
                throw new DimensionMismatchException("行の長さが揃っていません: row=" + i + ", expected="
                        + cols + ", actual=" + (rows[i] == null ? "null" : rows[i].length));
            }
        }
        return new DMatrixRMaj(rows);
    }

    /**
     * 行列を2次元配列に変換します。
     *
     * @param a 対象行列です
     * @return 値をコピーした2次元配列です
     */
    public static double[][] toRows(DMatrixRMaj a) {
        requireMatrix(a, "a");
        double[][] rows = new double[a.numRows][a.numCols];
        for (int i = 0; i < a.numRows; i++) {
            System.arraycopy(a.data, i * a.numCols, rows[i], 0, a.numCols);
        }
        return rows;
    }

    /**
     * 行列の複製を返します。
     *
     * @param a 対象行列です
     * @return 複製です
     */
    public static DMatrixRMaj copy(DMatrixRMaj a) {
        requireMatrix(a, "a");
        return a.copy();
    }

    /**
     * 内積を返します。
     *
     * @param a ベクトルです
     * @param b ベクトルです
     * @return a·b です
     * @throws DimensionMismatchException 長さが一致しない場合に発生します
     */
    public static double dot(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException("ベクトル長が一致しません: " + a.length + " vs " + b.length);
        }
        double s = 0.0;
        for (int i = 0; i < a.length; i++) {
            s += a[i] * b[i];
        }
        return s;
    }

    /**
     * ユークリッドノルムを返します。
     *
     * @param v ベクトルです
     * @return ‖v‖ です
     */
    public static double norm(double[] v) {
        return Math.sqrt(dot(v, v));
    }

    /**
     * 行列の形状を {@code rows×cols} 形式の文字列で返します。
     *
     * @param a 対象行列です
     * @return 形状文字列です
     */
    public static String shape(DMatrixRMaj a) {
        return a.numRows + "x" + a.numCols;
    }

    private static void requireMatrix(DMatrixRMaj a, String name) {
        if (a == null) {
            throw new IllegalArgumentException(name + " は null 不可です");
        }
    }
}
