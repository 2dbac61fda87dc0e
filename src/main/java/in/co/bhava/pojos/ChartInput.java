package in.co.bhava.pojos;

import java.util.Map;
import lombok.Data;

/**
 * JSON binding for the keyed chart shape:
 * <pre>
 * {
 *   "id": "chart-42",
 *   "ascendant": {"sign": "Aries", "longitude": 12.5},
 *   "planets": {"mars": {"longitude": 190.2, "sign": "Libra", "dignity": "Neutral", "retrograde": false}}
 * }
 * </pre>
 */
@Data
public class ChartInput {

    private String id;
    private AscendantInput ascendant;
    private Map<String, PlanetInput> planets;

    @Data
    public static class AscendantInput {
        private String sign;
        private Double longitude;
    }

    @Data
    public static class PlanetInput {
        private Double longitude;
        private String sign;
        private String dignity;
        private Boolean retrograde;
    }
}
