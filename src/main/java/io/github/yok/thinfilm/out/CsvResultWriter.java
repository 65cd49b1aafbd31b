package io.github.yok.thinfilm.out;

import io.github.yok.thinfilm.core.model.CoatingStack;
import io.github.yok.thinfilm.core.model.DesignLayer;
import io.github.yok.thinfilm.core.optics.OpticalResult;
import io.github.yok.thinfilm.core.optics.SpectralResponse;
import io.github.yok.thinfilm.core.optics.TransferMatrixEngine;
import io.github.yok.thinfilm.core.solver.OptimizationOutcome;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 計算結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（name は設計名）。
 * </p>
 *
 * <ul>
 * <li>{@code thinfilm_layers_SLAR.csv}（層構成と物理膜厚）</li>
 * <li>{@code thinfilm_spectrum_SLAR.csv}（Rs/Rp/Rave/Ts/Tp/Tave）</li>
 * <li>{@code thinfilm_meta_SLAR.csv}（評価関数、反復回数などの補助情報）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "thinfilm";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * 物理膜厚の換算に使う計算エンジンです。
     */
    private final TransferMatrixEngine engine;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @param engine 物理膜厚の換算に使う計算エンジンです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir, TransferMatrixEngine engine) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine は null 不可です");
        }
        this.outputDir = Paths.get(outputDir);
        this.engine = engine;
    }

    /**
     * 最適化後の設計と分光特性を出力します。
     *
     * @param stack 最適化後のコーティング設計です
     * @param outcome 最適化結果です
     * @param spectrum 最適化後の設計の分光特性です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(CoatingStack stack, OptimizationOutcome outcome, SpectralResponse spectrum) {
        if (stack == null) {
            throw new IllegalArgumentException("stack は null 不可です");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome は null 不可です");
        }
        if (spectrum == null) {
            throw new IllegalArgumentException("spectrum は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);

            writeLayersCsv(stack);
            writeSpectrumCsv(stack, spectrum);
            writeMetaCsv(stack, outcome);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 層構成を出力します。
     *
     * @param stack コーティング設計です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeLayersCsv(CoatingStack stack) throws IOException {
        Path file = outputDir.resolve(buildFileName("layers", stack.getName()));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("index", "material", "thicknessKind", "thickness",
                                "physicalThickness_um", "variable", "minThickness", "maxThickness")
                        .build().print(w)) {

            for (int i = 0; i < stack.layerCount(); i++) {
                DesignLayer layer = stack.layer(i);
                pr.printRecord(i + 1, layer.getMaterialId(), layer.getThicknessKind(),
                        layer.getThickness(), engine.physicalThickness(stack, layer),
                        layer.isVariable(), layer.getMinThickness(), layer.getMaxThickness());
            }
        }
    }

    /**
     * 分光特性を出力します。
     *
     * <p>
     * 先頭列は掃引軸に合わせて wavelength（µm）または aoi（度）になります。
     * </p>
     *
     * @param stack コーティング設計です
     * @param spectrum 分光特性です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeSpectrumCsv(CoatingStack stack, SpectralResponse spectrum)
            throws IOException {
        Path file = outputDir.resolve(buildFileName("spectrum", stack.getName()));

        String axis = spectrum.getAxis() == SpectralResponse.Axis.WAVELENGTH ? "wavelength" : "aoi";

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader(axis, "Rs", "Rp", "Rave", "Ts", "Tp", "Tave", "tir").build()
                        .print(w)) {

            double[] abscissa = spectrum.getAbscissa();
            for (int i = 0; i < spectrum.size(); i++) {
                OpticalResult r = spectrum.getResults().get(i);
                pr.printRecord(abscissa[i], r.getRs(), r.getRp(), r.getRave(), r.getTs(),
                        r.getTp(), r.getTave(), r.isTotalInternalReflection());
            }
        }
    }

    /**
     * 最適化結果と設計の補助情報を出力します。
     *
     * @param stack コーティング設計です
     * @param outcome 最適化結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(CoatingStack stack, OptimizationOutcome outcome)
            throws IOException {
        Path file = outputDir.resolve(buildFileName("meta", stack.getName()));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("design.name", stack.getName());
            pr.printRecord("design.substrate", stack.getSubstrateId());
            pr.printRecord("design.incidentIndex", stack.getIncidentIndex());
            pr.printRecord("design.referenceWavelength", stack.getReferenceWavelength());
            pr.printRecord("design.layerCount", stack.layerCount());

            pr.printRecord("success", outcome.isSuccess());
            pr.printRecord("message", outcome.getMessage());
            pr.printRecord("initialMerit", outcome.getInitialMerit());
            pr.printRecord("finalMerit", outcome.getFinalMerit());
            pr.printRecord("iterations", outcome.getIterations());
            pr.printRecord("trials", outcome.getTrials());
            pr.printRecord("cancelled", outcome.isCancelled());
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code thinfilm_spectrum_SLAR.csv}。設計名のうち英数字と {@code . _ -} 以外は {@code _} に置き換えます。
     * </p>
     *
     * @param kind 出力の識別子（layers/spectrum/meta）です
     * @param designName 設計名です
     * @return ファイル名です
     */
    static String buildFileName(String kind, String designName) {
        return FILE_HEAD + "_" + kind + "_" + designName.replaceAll("[^A-Za-z0-9._-]", "_")
                + ".csv";
    }
}
