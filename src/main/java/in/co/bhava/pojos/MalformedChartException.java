package in.co.bhava.pojos;

/**
 * Thrown when a chart cannot be analysed at all: the ascendant is missing or a longitude is not a
 * finite number in [0, 360). The analysis facade turns this into a failed {@link AnalysisResult}.
 */
public class MalformedChartException extends RuntimeException {

    public MalformedChartException(String message) {
        super(message);
    }

    public MalformedChartException(String message, Throwable cause) {
        super(message, cause);
    }
}
