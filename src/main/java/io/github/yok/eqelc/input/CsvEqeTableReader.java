package io.github.yok.eqelc.input;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.eqelc.core.error.ValidationException;
import io.github.yok.eqelc.core.junction.JunctionEqeSet;
import io.github.yok.eqelc.core.spectrum.SpectralGrid;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * 測定 EQE を CSV から読み込むクラスです。
 *
 * <p>
 * 1 行目はヘッダ（{@code wavelength,<接合名>,...}）、以降は 1 行 1 波長です。 接合列の並びはスタックの上から下の順とします。
 * </p>
 */
@Slf4j
public final class CsvEqeTableReader implements EqeTableReader {

    /**
     * CSV を読み込みます。
     *
     * @param file 入力ファイルです
     * @return EQE 集合です
     * @throws ValidationException 列数不足や数値でない値がある場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    @Override
    public JunctionEqeSet read(Path file) {
        checkNotNull(file, "file は null 不可です");

        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader()
                .setSkipHeaderRecord(true).setIgnoreSurroundingSpaces(true)
                .setIgnoreEmptyLines(true).build();

        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = format.parse(r)) {

            List<String> header = parser.getHeaderNames();
            if (header.size() < 2) {
                throw new ValidationException("EQE 表には波長列と 1 列以上の接合列が必要です: " + file);
            }
            List<String> names = new ArrayList<>(header.subList(1, header.size()));
            int n = names.size();

            List<Double> wavelengths = new ArrayList<>();
            List<double[]> rows = new ArrayList<>();
            for (CSVRecord rec : parser) {
                if (rec.size() != header.size()) {
                    throw new ValidationException("列数がヘッダと一致しません: line="
                            + rec.getRecordNumber() + ", " + rec.size() + " vs " + header.size());
                }
                wavelengths.add(parse(rec, 0, file));
                double[] row = new double[n];
                for (int j = 0; j < n; j++) {
                    row[j] = parse(rec, j + 1, file);
                }
                rows.add(row);
            }

            double[] wl = new double[wavelengths.size()];
            double[][] curves = new double[n][wl.length];
            for (int k = 0; k < wl.length; k++) {
                wl[k] = wavelengths.get(k);
                for (int j = 0; j < n; j++) {
                    curves[j][k] = rows.get(k)[j];
                }
            }

            log.info("EQE 表を読み込みました: {}（接合={}, 波長点数={}）", file, names, wl.length);
            return JunctionEqeSet.of(SpectralGrid.of(wl), names, curves);

        } catch (IOException e) {
            throw new IllegalStateException("EQE 表の読み込みに失敗しました: " + file, e);
        }
    }

    private static double parse(CSVRecord rec, int column, Path file) {
        String s = rec.get(column);
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new ValidationException("数値として解釈できません: " + file + " line="
                    + rec.getRecordNumber() + ", column=" + column + ", value=" + s, e);
        }
    }
}
