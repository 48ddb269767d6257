package io.github.yok.eqelc.input;

import io.github.yok.eqelc.core.junction.JunctionEqeSet;
import java.nio.file.Path;

/**
 * 測定 EQE の表を読み込む処理のインタフェースです。
 */
public interface EqeTableReader {

    /**
     * 表を読み込み、接合ごとの EQE 集合を返します。
     *
     * @param file 入力ファイルです
     * @return EQE 集合です（列順 = スタックの上から下）
     */
    JunctionEqeSet read(Path file);
}
