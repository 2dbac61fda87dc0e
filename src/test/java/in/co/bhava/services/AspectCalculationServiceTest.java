package in.co.bhava.services;

import in.co.bhava.pojos.AspectKind;
import in.co.bhava.pojos.AspectResult;
import in.co.bhava.pojos.Chart;
import in.co.bhava.pojos.Planet;
import in.co.bhava.pojos.ZodiacSign;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AspectCalculationService}.
 * Charts use an Aries ascendant at 0°, so house h spans [(h-1)*30, h*30) with its middle at (h-1)*30 + 15.
 *
 * Naming convention: test_<scenario>_<expectedBehaviour>
 */
public class AspectCalculationServiceTest {

    private static final double DELTA = 0.0001;

    private final AspectCalculationService service = new AspectCalculationService(Map.of());

    private static Chart.Builder ariesChart() {
        return Chart.builder().id("aspect-test").ascendant(ZodiacSign.ARIES, 0.0);
    }

    @Test
    public void test_chartWithoutPlanets_noAspects() {
        Chart chart = ariesChart().build();
        for (int house = 1; house <= 12; house++) {
            assertTrue(service.aspectsOnHouse(chart, house).isEmpty());
        }
    }

    @Test
    public void test_exactConjunction_fullStrength() {
        Chart chart = ariesChart().planet(Planet.VENUS, 15.0).build();
        List<AspectResult> aspects = service.aspectsOnHouse(chart, 1);

        assertEquals(1, aspects.size());
        AspectResult conjunction = aspects.get(0);
        assertEquals(AspectKind.CONJUNCTION, conjunction.getKind());
        assertEquals(Planet.VENUS, conjunction.getSourcePlanet());
        assertEquals(0.0, conjunction.getOrbDegrees(), DELTA);
        assertEquals(100, conjunction.getStrengthPercent());
        assertNull(conjunction.getDrishtiHouse());
    }

    @Test
    public void test_sextileFiveDegreesOff_strengthScalesWithOrb() {
        // separation 65°, error 5 of a 6° orb -> round(100 / 6) = 17
        Chart chart = ariesChart().planet(Planet.MOON, 80.0).build();
        List<AspectResult> aspects = service.aspectsOnHouse(chart, 1);

        assertEquals(1, aspects.size());
        assertEquals(AspectKind.SEXTILE, aspects.get(0).getKind());
        assertEquals(5.0, aspects.get(0).getOrbDegrees(), DELTA);
        assertEquals(17, aspects.get(0).getStrengthPercent());
    }

    @Test
    public void test_separationOutsideEveryOrb_noAngularAspect() {
        // 45° from the middle of house 1
        Chart chart = ariesChart().planet(Planet.MERCURY, 60.0).build();
        assertTrue(service.aspectsOnHouse(chart, 1).isEmpty());
    }

    @Test
    public void test_marsInSeventh_drishtiAndOppositionOnFirst() {
        // Mars at 190° sits in house 7; 7th drishti reaches house 1, opposition is 5° off exact
        Chart chart = ariesChart().planet(Planet.MARS, 190.0).build();
        List<AspectResult> aspects = service.aspectsOnHouse(chart, 1);

        assertEquals(2, aspects.size(), "both results are kept: " + aspects);
        AspectResult drishti = aspects.get(0);
        assertEquals(AspectKind.GRAHA_DRISHTI, drishti.getKind());
        assertEquals(7, drishti.getSourceHouse());
        assertEquals(7, drishti.getDrishtiHouse());
        assertEquals(75, drishti.getStrengthPercent());
        assertNull(drishti.getOrbDegrees());

        AspectResult opposition = aspects.get(1);
        assertEquals(AspectKind.OPPOSITION, opposition.getKind());
        assertEquals(5.0, opposition.getOrbDegrees(), DELTA);
        assertEquals(38, opposition.getStrengthPercent());
    }

    @Test
    public void test_marsSpecialAspects_reachFourthAndEighthHouses() {
        // Mars in house 7: 4th -> house 10, 8th -> house 2
        Chart chart = ariesChart().planet(Planet.MARS, 190.0).build();

        List<AspectResult> onTenth = service.planetsAspectingHouse(chart, 10);
        assertEquals(1, onTenth.size());
        assertEquals(4, onTenth.get(0).getDrishtiHouse());

        List<AspectResult> onSecond = service.planetsAspectingHouse(chart, 2);
        assertEquals(1, onSecond.size());
        assertEquals(8, onSecond.get(0).getDrishtiHouse());

        assertTrue(service.planetsAspectingHouse(chart, 3).isEmpty());
    }

    @Test
    public void test_jupiterTrineAndFifthDrishti_drishtiRankedFirst() {
        // Jupiter at 10° in house 1: 5th drishti on house 5 (80%), trine to 135° is 5° off (38%)
        Chart chart = ariesChart().planet(Planet.JUPITER, 10.0).build();
        List<AspectResult> aspects = service.aspectsOnHouse(chart, 5);

        assertEquals(2, aspects.size());
        assertEquals(AspectKind.GRAHA_DRISHTI, aspects.get(0).getKind());
        assertEquals(5, aspects.get(0).getDrishtiHouse());
        assertEquals(80, aspects.get(0).getStrengthPercent());
        assertEquals(AspectKind.TRINE, aspects.get(1).getKind());
        assertEquals(38, aspects.get(1).getStrengthPercent());
    }

    @Test
    public void test_exactSextileOutranksSaturnDrishti() {
        // Saturn at 345° in house 12: 3rd drishti on house 2 (70%), exactly 60° from its middle (100%)
        Chart chart = ariesChart().planet(Planet.SATURN, 345.0).build();
        List<AspectResult> aspects = service.aspectsOnHouse(chart, 2);

        assertEquals(2, aspects.size());
        assertEquals(AspectKind.SEXTILE, aspects.get(0).getKind());
        assertEquals(100, aspects.get(0).getStrengthPercent());
        assertEquals(AspectKind.GRAHA_DRISHTI, aspects.get(1).getKind());
        assertEquals(3, aspects.get(1).getDrishtiHouse());
        assertEquals(70, aspects.get(1).getStrengthPercent());
    }

    @Test
    public void test_nodes_aspectFifthSeventhNinthAtSixtyPercent() {
        // Rahu at 100° in house 4 reaches 8, 10 and 12
        Chart chart = ariesChart().planet(Planet.RAHU, 100.0).build();
        for (int target : new int[]{8, 10, 12}) {
            List<AspectResult> drishti = service.planetsAspectingHouse(chart, target);
            assertEquals(1, drishti.size(), "house " + target);
            assertEquals(60, drishti.get(0).getStrengthPercent());
        }
        assertTrue(service.planetsAspectingHouse(chart, 11).isEmpty());
    }

    @Test
    public void test_equalStrength_keepsPlanetOrder() {
        // Venus conjunct and Mercury opposite the middle of house 1, both exact
        Chart chart = ariesChart()
                .planet(Planet.VENUS, 15.0)
                .planet(Planet.MERCURY, 195.0)
                .build();
        List<AspectResult> aspects = service.aspectsOnHouse(chart, 1);

        assertEquals(2, aspects.size());
        assertEquals(Planet.MERCURY, aspects.get(0).getSourcePlanet());
        assertEquals(Planet.VENUS, aspects.get(1).getSourcePlanet());
    }

    @Test
    public void test_narrowedOrb_dropsAspectBeyondIt() {
        AspectCalculationService narrow = new AspectCalculationService(Map.of(AspectKind.OPPOSITION, 4.0));
        Chart chart = ariesChart().planet(Planet.MARS, 190.0).build();
        List<AspectResult> aspects = narrow.aspectsOnHouse(chart, 1);

        assertEquals(1, aspects.size());
        assertEquals(AspectKind.GRAHA_DRISHTI, aspects.get(0).getKind());
        assertEquals(4.0, narrow.getOrb(AspectKind.OPPOSITION), DELTA);
        assertEquals(8.0, narrow.getOrb(AspectKind.TRINE), DELTA);
    }

    @Test
    public void test_nonPositiveOrb_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new AspectCalculationService(Map.of(AspectKind.SEXTILE, 0.0)));
    }

    @Test
    public void test_defaultConstructor_readsBundledOrbs() {
        AspectCalculationService configured = new AspectCalculationService();
        assertEquals(6.0, configured.getOrb(AspectKind.SEXTILE), DELTA);
        assertEquals(8.0, configured.getOrb(AspectKind.CONJUNCTION), DELTA);
    }

    @Test
    public void test_invalidHouse_throws() {
        Chart chart = ariesChart().build();
        assertThrows(IllegalArgumentException.class, () -> service.aspectsOnHouse(chart, 0));
        assertThrows(IllegalArgumentException.class, () -> service.aspectsOnHouse(chart, 13));
    }
}
