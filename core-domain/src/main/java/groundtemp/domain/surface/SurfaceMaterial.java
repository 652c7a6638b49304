package groundtemp.domain.surface;

import lombok.Builder;
import lombok.With;

/**
 * Propiedades termo-ópticas inmutables de un revestimiento del suelo.
 *
 * @param name                          Identificador del material (clave de agrupación).
 * @param albedo                        Albedo (0-1).
 * @param emissivity                    Emisividad de onda larga (0-1).
 * @param volumetricHeatCapacity        Capacidad calorífica volumétrica Cv [J/m³·K].
 * @param thermalConductivity           Conductividad térmica λ [W/m·K].
 * @param thickness                     Espesor de la capa ep [m].
 * @param evapotranspirationCoefficient Coeficiente de cultivo kc (0 = superficie seca).
 * @param fixedTemperature              Temperatura impuesta en °C; 0 significa "no impuesta".
 */
@Builder
@With
public record SurfaceMaterial(
        String name,
        double albedo,
        double emissivity,
        double volumetricHeatCapacity,
        double thermalConductivity,
        double thickness,
        double evapotranspirationCoefficient,
        double fixedTemperature
) {

    public boolean hasFixedTemperature() {
        return fixedTemperature != 0.0;
    }

    /**
     * Conductancia de la capa λ/ep [W/m²·K].
     */
    public double conductance() {
        return thermalConductivity / thickness;
    }

    /**
     * Capacidad de almacenamiento por hora Cv·ep/3600 [W/m²·K].
     */
    public double hourlyStorageCoefficient() {
        return volumetricHeatCapacity * thickness / 3600.0;
    }

    /**
     * Verifica que el material tiene todos los campos numéricos que necesita el solver.
     * Un material con temperatura impuesta sólo necesita esa temperatura.
     *
     * @return el propio material, para encadenar.
     * @throws MissingMaterialPropertyException si falta algún campo o no es un número.
     */
    public SurfaceMaterial validate() {
        if (name == null || name.isBlank()) {
            throw new MissingMaterialPropertyException("<sin nombre>", "Material");
        }
        require(fixedTemperature, "FixedTemp");
        if (hasFixedTemperature()) {
            return this;
        }
        require(albedo, "alb");
        require(emissivity, "em");
        require(volumetricHeatCapacity, "Cv");
        require(thermalConductivity, "lambd");
        require(thickness, "ep");
        require(evapotranspirationCoefficient, "kc");
        if (thickness <= 0) {
            throw new MissingMaterialPropertyException(name, "ep", "el espesor debe ser positivo");
        }
        return this;
    }

    private void require(double value, String property) {
        if (!Double.isFinite(value)) {
            throw new MissingMaterialPropertyException(name, property);
        }
    }
}
