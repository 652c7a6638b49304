package groundtemp.domain.surface;

import lombok.Builder;

import java.util.Arrays;
import java.util.Objects;

/**
 * Punto de muestreo suministrado por el preprocesado geográfico.
 *
 * @param id             Identificador del punto.
 * @param x              Coordenada X proyectada.
 * @param y              Coordenada Y proyectada.
 * @param longitude      Longitud geográfica [grados Este].
 * @param latitude       Latitud geográfica [grados Norte].
 * @param material       Material del suelo en ese punto.
 * @param sunlitFraction Fracción soleada de cada hora (1 = al sol, 0 = en sombra), 24 valores.
 */
@Builder
public record PointSample(
        String id,
        double x,
        double y,
        double longitude,
        double latitude,
        SurfaceMaterial material,
        double[] sunlitFraction
) {

    public PointSample {
        Objects.requireNonNull(id, "El identificador del punto no puede ser nulo.");
        Objects.requireNonNull(material, "El material del punto " + id + " no puede ser nulo.");
        Objects.requireNonNull(sunlitFraction, "La serie de sombras del punto " + id + " no puede ser nula.");
        if (sunlitFraction.length != 24) {
            throw new IllegalArgumentException("El punto " + id + " debe tener 24 fracciones soleadas, tiene " + sunlitFraction.length);
        }
        sunlitFraction = sunlitFraction.clone();
    }

    @Override
    public double[] sunlitFraction() {
        return sunlitFraction.clone();
    }

    public double getSunlitFractionAt(int hour) {
        return sunlitFraction[hour];
    }

    public EquivalenceKey equivalenceKey() {
        return new EquivalenceKey(material.name(), sunlitFraction);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PointSample that = (PointSample) o;
        return Double.compare(x, that.x) == 0 && Double.compare(y, that.y) == 0 &&
                Double.compare(longitude, that.longitude) == 0 && Double.compare(latitude, that.latitude) == 0 &&
                id.equals(that.id) && material.equals(that.material) &&
                Arrays.equals(sunlitFraction, that.sunlitFraction);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(id, x, y, longitude, latitude, material) + Arrays.hashCode(sunlitFraction);
    }

    @Override
    public String toString() {
        return "PointSample{id=" + id + ", material=" + material.name() + "}";
    }
}
