package io.github.yok.eqelc.out;

import io.github.yok.eqelc.core.junction.JunctionEqeSet;
import io.github.yok.eqelc.core.solver.ConvergenceRecord;
import io.github.yok.eqelc.core.solver.CorrectionResultSet;
import io.github.yok.eqelc.core.spectrum.SpectralGrid;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * LC 補正結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（spectrum はスペクトル種別の小文字）。
 * </p>
 *
 * <ul>
 * <li>{@code eqelc_correctedEqe_spectrum=global.csv}（波長ごとの補正 EQE）</li>
 * <li>{@code eqelc_currents_spectrum=global.csv}（接合ごとの測定/補正/LC 電流）</li>
 * <li>{@code eqelc_meta_spectrum=global.csv}（収束記録などの補助情報）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "eqelc";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 補正結果を出力します。
     *
     * @param result 補正結果です
     * @param tolerance 補正に用いた許容誤差です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(CorrectionResultSet result, double tolerance) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
        if (!Double.isFinite(tolerance)) {
            throw new IllegalArgumentException("tolerance は有限値を指定してください: " + tolerance);
        }

        String spectrum = (result.getSpectrumKind() != null)
                ? result.getSpectrumKind().name().toLowerCase(Locale.ROOT)
                : "unknown";

        try {
            Files.createDirectories(outputDir);

            // 1) 補正 EQE
            writeCorrectedEqeCsv(result, spectrum);

            // 2) 接合電流
            writeCurrentsCsv(result, spectrum);

            // 3) メタ（収束記録など）
            writeMetaCsv(result, tolerance, spectrum);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 補正 EQE を、入力表と同じ形（波長 × 接合）で出力します。
     *
     * @param result 補正結果です
     * @param spectrum スペクトル識別子です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeCorrectedEqeCsv(CorrectionResultSet result, String spectrum)
            throws IOException {

        Path file = outputDir.resolve(buildFileName("correctedEqe", spectrum));

        JunctionEqeSet corrected = result.getCorrected();
        SpectralGrid grid = result.getGrid();

        List<String> header = new ArrayList<>();
        header.add("wavelength");
        header.addAll(corrected.getJunctionNames());

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader(header.toArray(new String[0])).build().print(w)) {

            for (int k = 0; k < grid.size(); k++) {
                List<Object> row = new ArrayList<>(header.size());
                row.add(grid.wavelengthAt(k));
                for (int j = 0; j < corrected.junctionCount(); j++) {
                    row.add(corrected.valueAt(j, k));
                }
                pr.printRecord(row);
            }
        }
    }

    /**
     * 接合ごとの電流を出力します。
     *
     * @param result 補正結果です
     * @param spectrum スペクトル識別子です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeCurrentsCsv(CorrectionResultSet result, String spectrum)
            throws IOException {

        Path file = outputDir.resolve(buildFileName("currents", spectrum));

        List<String> names = result.getCorrected().getJunctionNames();
        double[] measured = result.getMeasuredCurrents();
        double[] corrected = result.getCurrents();
        int limiting = result.limitingJunction();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("junction", "name", "measuredJsc", "correctedJsc", "couplingJsc",
                                "limiting")
                        .build().print(w)) {

            for (int j = 0; j < corrected.length; j++) {
                pr.printRecord(j, names.get(j), measured[j], corrected[j],
                        result.couplingCurrent(j), j == limiting);
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param result 補正結果です
     * @param tolerance 許容誤差です
     * @param spectrum スペクトル識別子です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(CorrectionResultSet result, double tolerance, String spectrum)
            throws IOException {

        Path file = outputDir.resolve(buildFileName("meta", spectrum));

        ConvergenceRecord record = result.getConvergence();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("spectrum.kind", result.getSpectrumKind());
            pr.printRecord("spectrum.name", result.getSpectrumName());

            pr.printRecord("grid.first", result.getGrid().first());
            pr.printRecord("grid.last", result.getGrid().last());
            pr.printRecord("grid.points", result.getGrid().size());

            pr.printRecord("converged", result.isConverged());
            pr.printRecord("iterations", record.getIterations());
            pr.printRecord("maxDelta", record.getMaxDelta());
            pr.printRecord("tolerance", tolerance);

            pr.printRecord("limitingJunction", record.getLimitingJunction());
            pr.printRecord("limitingCurrent", result.limitingCurrent());
            pr.printRecord("currentMismatch", result.currentMismatch());
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code eqelc_currents_spectrum=global.csv}
     * </p>
     *
     * @param kind 量の識別子（correctedEqe/currents/meta）
     * @param spectrum スペクトル識別子です
     * @return ファイル名です
     */
    static String buildFileName(String kind, String spectrum) {
        return FILE_HEAD + "_" + kind + "_spectrum=" + spectrum + ".csv";
    }
}
