package in.co.bhava.pojos;

import com.google.gson.annotations.SerializedName;
import lombok.Data;

/**
 * One entry of {@code output[1]} in the ephemeris provider's planets response.
 * The provider sends the ascendant as an entry named "Ascendant".
 */
@Data
public class ThirdPartyPlanetData {

    private String name;
    private Double fullDegree;

    /** "true" / "false" as a string. */
    private String isRetro;

    /** 1 = Aries. */
    @SerializedName("current_sign")
    private Integer currentSign;
}
