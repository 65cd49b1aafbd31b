package io.github.yok.thinfilm.core.dispersion;

import com.google.common.base.Preconditions;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * コーティング材料と基板の分散式を保持するカタログです。
 *
 * <p>
 * {@link #withStandardMaterials()} は代表的なコーティング材料（MgF2, SiO2, Al2O3, ZrO2, Ta2O5, TiO2, HfO2）と 基板（N-BK7,
 * N-SF11, FUSED_SILICA, AIR）を登録した状態で生成します。 名前は大文字小文字を区別しません。
 * </p>
 */
@Slf4j
public final class MaterialCatalog implements DispersionProvider {

    /**
     * コーティング材料です（キーは大文字化した名前）。
     */
    private final Map<String, Material> materials = new ConcurrentHashMap<>();

    /**
     * 基板です（キーは大文字化した名前）。
     */
    private final Map<String, Material> substrates = new ConcurrentHashMap<>();

    /**
     * 標準材料と標準基板を登録したカタログを生成します。
     *
     * @return カタログです
     */
    public static MaterialCatalog withStandardMaterials() {
        MaterialCatalog catalog = new MaterialCatalog();

        catalog.registerMaterial("MgF2", SellmeierDispersion.standard(1.38, 0.48755108,
                0.001882178, 0.39875031, 0.008951888, 2.3120353, 566.13559));
        catalog.registerMaterial("SiO2", SellmeierDispersion.standard(1.46, 0.6961663, 0.0046791,
                0.4079426, 0.0135121, 0.8974794, 97.9340));
        catalog.registerMaterial("Al2O3", SellmeierDispersion.standard(1.77, 1.4313493, 0.0052799,
                0.65054713, 0.0142383, 5.3414021, 325.01783));
        catalog.registerMaterial("ZrO2", new CauchyDispersion(1.92, 0.022, 0.002, 0.0));
        catalog.registerMaterial("Ta2O5", new CauchyDispersion(1.97, 0.022, 0.002, 0.0));
        catalog.registerMaterial("TiO2", new CauchyDispersion(2.20, 0.030, 0.003, 0.0));
        catalog.registerMaterial("HfO2", new CauchyDispersion(1.84, 0.018, 0.002, 0.0));

        // Schott の公開係数
        catalog.registerSubstrate("N-BK7", SellmeierDispersion.standard(1.5168, 1.03961212,
                0.00600069867, 0.231792344, 0.0200179144, 1.01046945, 103.560653));
        catalog.registerSubstrate("N-SF11", SellmeierDispersion.standard(1.78472, 1.73759695,
                0.013188707, 0.313747346, 0.0623068142, 1.89878101, 155.23629));
        catalog.registerSubstrate("FUSED_SILICA", SellmeierDispersion.standard(1.4585, 0.6961663,
                0.0046791, 0.4079426, 0.0135121, 0.8974794, 97.9340));
        catalog.registerSubstrate("AIR", new ConstantDispersion(1.0, 0.0));

        return catalog;
    }

    /**
     * コーティング材料を登録します。同名の材料は置き換えます。
     *
     * @param name 材料名です
     * @param dispersion 分散式です
     * @return 登録した材料です
     */
    public Material registerMaterial(String name, DispersionFormula dispersion) {
        Material material = newMaterial(name, dispersion);
        if (materials.put(key(name), material) != null) {
            log.info("コーティング材料を置き換えました。name={}", name);
        }
        return material;
    }

    /**
     * 基板を登録します。同名の基板は置き換えます。
     *
     * @param name 基板名です
     * @param dispersion 分散式です
     * @return 登録した基板です
     */
    public Material registerSubstrate(String name, DispersionFormula dispersion) {
        Material substrate = newMaterial(name, dispersion);
        if (substrates.put(key(name), substrate) != null) {
            log.info("基板を置き換えました。name={}", name);
        }
        return substrate;
    }

    /**
     * 登録済みのコーティング材料名を返します。
     *
     * @return 材料名の集合（昇順）です
     */
    public Set<String> materialNames() {
        Set<String> names = new TreeSet<>();
        materials.values().forEach(m -> names.add(m.getName()));
        return names;
    }

    /**
     * 登録済みの基板名を返します。
     *
     * @return 基板名の集合（昇順）です
     */
    public Set<String> substrateNames() {
        Set<String> names = new TreeSet<>();
        substrates.values().forEach(m -> names.add(m.getName()));
        return names;
    }

    @Override
    public ComplexIndex materialIndex(String materialId, double wavelengthUm) {
        return lookup(materials, materialId, "コーティング材料").indexAt(wavelengthUm);
    }

    @Override
    public double substrateIndex(String substrateId, double wavelengthUm) {
        return lookup(substrates, substrateId, "基板").indexAt(wavelengthUm).getN();
    }

    private static Material newMaterial(String name, DispersionFormula dispersion) {
        Preconditions.checkArgument(name != null && !name.trim().isEmpty(), "材料名は必須です。");
        Preconditions.checkNotNull(dispersion, "分散式が null です。name=%s", name);
        return new Material(name, dispersion);
    }

    private static Material lookup(Map<String, Material> table, String name, String label) {
        if (name == null) {
            throw new IllegalArgumentException(label + "名が null です");
        }
        Material material = table.get(key(name));
        if (material == null) {
            throw new IllegalArgumentException(label + "が見つかりません: " + name);
        }
        return material;
    }

    private static String key(String name) {
        return name.trim().toUpperCase(java.util.Locale.ROOT);
    }
}
