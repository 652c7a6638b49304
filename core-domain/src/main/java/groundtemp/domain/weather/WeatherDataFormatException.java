package groundtemp.domain.weather;

/**
 * El fichero meteorológico está mal formado o no contiene el día solicitado.
 * Es un error fatal: se lanza antes de resolver ningún punto.
 */
public class WeatherDataFormatException extends RuntimeException {

    public WeatherDataFormatException(String message) {
        super(message);
    }

    public WeatherDataFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
