package in.co.bhava.services;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import in.co.bhava.pojos.Chart;
import in.co.bhava.pojos.ChartInput;
import in.co.bhava.pojos.Dignity;
import in.co.bhava.pojos.MalformedChartException;
import in.co.bhava.pojos.Planet;
import in.co.bhava.pojos.ThirdPartyPlanetData;
import in.co.bhava.pojos.ZodiacSign;

import java.util.Map;
import java.util.Optional;

/**
 * Turns chart JSON into a {@link Chart}. Two shapes are accepted:
 * <ul>
 *   <li>the keyed shape bound by {@link ChartInput}</li>
 *   <li>the ephemeris provider's planets response, where {@code output[1]} maps body names to
 *       {@link ThirdPartyPlanetData} and the ascendant is the "Ascendant" entry</li>
 * </ul>
 * A document with a top-level {@code output} array is read as the provider shape. Bodies outside
 * the nine grahas are skipped. Anything unusable ends in {@link MalformedChartException}.
 */
public class ChartParser {

    private static final String ASCENDANT_ENTRY = "Ascendant";

    private final Gson gson = new Gson();

    public Chart parse(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedChartException("Chart JSON is empty");
        }
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new MalformedChartException("Chart JSON could not be parsed: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new MalformedChartException("Chart JSON must be an object");
        }
        JsonObject object = root.getAsJsonObject();
        try {
            if (object.has("output")) {
                return parseThirdParty(object);
            }
            return parseKeyed(gson.fromJson(object, ChartInput.class));
        } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
            // Gson reports type mismatches (a string where a number belongs) through these
            throw new MalformedChartException("Chart JSON has an unexpected structure: " + e.getMessage(), e);
        }
    }

    Chart parseKeyed(ChartInput input) {
        if (input == null || input.getAscendant() == null) {
            throw new MalformedChartException("Ascendant is missing");
        }
        Chart.Builder builder = Chart.builder()
                .id(input.getId())
                .ascendant(input.getAscendant().getSign(), input.getAscendant().getLongitude());

        if (input.getPlanets() != null) {
            for (Map.Entry<String, ChartInput.PlanetInput> entry : input.getPlanets().entrySet()) {
                Optional<Planet> planet = Planet.fromName(entry.getKey());
                if (planet.isEmpty()) {
                    LoggingService.debug("chart_body_skipped", LoggingService.data("body", entry.getKey()));
                    continue;
                }
                ChartInput.PlanetInput data = entry.getValue();
                if (data == null || data.getLongitude() == null) {
                    throw new MalformedChartException(planet.get().getDisplayName() + " longitude is missing");
                }
                builder.planet(planet.get(), data.getLongitude(), parseSign(planet.get(), data.getSign()),
                        Dignity.fromLabel(data.getDignity()), Boolean.TRUE.equals(data.getRetrograde()));
            }
        }
        return builder.build();
    }

    private Chart parseThirdParty(JsonObject root) {
        JsonElement output = root.get("output");
        if (!output.isJsonArray()) {
            throw new MalformedChartException("Invalid response format: output is not an array");
        }
        JsonArray outputList = output.getAsJsonArray();
        if (outputList.size() < 2) {
            throw new MalformedChartException("Invalid response format: output array has less than 2 elements");
        }
        JsonElement named = outputList.get(1);
        if (!named.isJsonObject()) {
            throw new MalformedChartException("Invalid response format: second output element is not a map");
        }

        Chart.Builder builder = Chart.builder();
        if (root.has("id") && root.get("id").isJsonPrimitive()) {
            builder.id(root.get("id").getAsString());
        }
        boolean ascendantSeen = false;
        for (Map.Entry<String, JsonElement> entry : named.getAsJsonObject().entrySet()) {
            // "ayanamsa", "debug" and similar entries are not bodies
            if (!entry.getValue().isJsonObject()) {
                continue;
            }
            ThirdPartyPlanetData data = gson.fromJson(entry.getValue(), ThirdPartyPlanetData.class);
            String name = data.getName() != null ? data.getName() : entry.getKey();

            if (ASCENDANT_ENTRY.equalsIgnoreCase(name)) {
                ascendantSeen = true;
                builder.ascendant(signName(data.getCurrentSign(), name), data.getFullDegree());
                continue;
            }
            Optional<Planet> planet = Planet.fromName(name);
            if (planet.isEmpty()) {
                LoggingService.debug("chart_body_skipped", LoggingService.data("body", name));
                continue;
            }
            if (data.getFullDegree() == null) {
                throw new MalformedChartException(planet.get().getDisplayName() + " fullDegree is missing");
            }
            ZodiacSign sign = data.getCurrentSign() == null ? null : signOf(data.getCurrentSign(), name);
            builder.planet(planet.get(), data.getFullDegree(), sign, null, "true".equalsIgnoreCase(data.getIsRetro()));
        }
        if (!ascendantSeen) {
            throw new MalformedChartException("Ascendant entry is missing from output[1]");
        }
        return builder.build();
    }

    private static ZodiacSign parseSign(Planet planet, String sign) {
        if (sign == null || sign.isBlank()) {
            return null;
        }
        try {
            return ZodiacSign.fromName(sign);
        } catch (IllegalArgumentException e) {
            throw new MalformedChartException("Unrecognised sign for " + planet.getDisplayName() + ": " + sign, e);
        }
    }

    private static String signName(Integer currentSign, String body) {
        return currentSign == null ? null : signOf(currentSign, body).name();
    }

    private static ZodiacSign signOf(int currentSign, String body) {
        try {
            return ZodiacSign.fromNumber(currentSign);
        } catch (IllegalArgumentException e) {
            throw new MalformedChartException("Unrecognised current_sign for " + body + ": " + currentSign, e);
        }
    }
}
