package io.github.yok.eqelc.input;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.primitives.Doubles;
import io.github.yok.eqelc.core.error.ValidationException;
import io.github.yok.eqelc.core.spectrum.PhotonFluxSpectrum;
import io.github.yok.eqelc.core.spectrum.SpectrumKind;
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
 * 基準照射スペクトルを CSV から読み込むクラスです。
 *
 * <p>
 * 先頭の表題行・ヘッダ行など、1 列目が数値でない行は読み飛ばします。 値の列は {@link SpectrumKind#getColumnIndex()} で決まるため、
 * ASTM G173 の表をそのまま DIRECT/GLOBAL で読めます。
 * </p>
 */
@Slf4j
public final class CsvSpectrumReader implements SpectrumReader {

    /**
     * CSV を読み込みます。
     *
     * @param file 入力ファイルです
     * @param kind スペクトル種別です
     * @param name 表示名です
     * @param quantity 表に格納されている量です
     * @return 光子束スペクトルです
     * @throws ValidationException 必要な列がない、または値が不正な場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    @Override
    public PhotonFluxSpectrum read(Path file, SpectrumKind kind, String name, Quantity quantity) {
        checkNotNull(file, "file は null 不可です");
        checkNotNull(kind, "kind は null 不可です");
        checkNotNull(quantity, "quantity は null 不可です");

        int column = kind.getColumnIndex();
        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                .setIgnoreSurroundingSpaces(true).setIgnoreEmptyLines(true).build();

        List<Double> wavelengths = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        int skipped = 0;

        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = format.parse(r)) {

            for (CSVRecord rec : parser) {
                Double wl = Doubles.tryParse(rec.get(0));
                if (wl == null) {
                    skipped++;
                    continue;
                }
                if (rec.size() <= column) {
                    throw new ValidationException("スペクトル " + kind + " の列（index=" + column
                            + "）がありません: line=" + rec.getRecordNumber());
                }
                Double v = Doubles.tryParse(rec.get(column));
                if (v == null) {
                    throw new ValidationException("数値として解釈できません: line=" + rec.getRecordNumber()
                            + ", value=" + rec.get(column));
                }
                wavelengths.add(wl);
                values.add(v);
            }
        } catch (IOException e) {
            throw new IllegalStateException("スペクトルの読み込みに失敗しました: " + file, e);
        }

        double[] wl = Doubles.toArray(wavelengths);
        double[] data = Doubles.toArray(values);
        log.info("スペクトルを読み込みました: {}（種別={}, 量={}, 点数={}, 読み飛ばした行={}）", file, kind, quantity,
                wl.length, skipped);

        if (quantity == Quantity.IRRADIANCE) {
            return PhotonFluxSpectrum.fromSpectralIrradiance(kind, name, wl, data);
        }
        return PhotonFluxSpectrum.of(kind, name, wl, data);
    }
}
