package com.optionsanalytics.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.optionsanalytics.config.PricingConfig;
import com.optionsanalytics.core.processor.BlackScholesPricer;
import com.optionsanalytics.core.processor.GreeksCalculator;
import com.optionsanalytics.core.processor.StandardNormal;
import com.optionsanalytics.domain.enums.OptionType;
import com.optionsanalytics.domain.model.OptionChain;
import com.optionsanalytics.domain.model.OptionChainEntry;
import com.optionsanalytics.domain.model.OptionData;
import com.optionsanalytics.exception.InvalidInputException;
import com.optionsanalytics.service.OptionChainService;
import com.optionsanalytics.service.StrikeLadder;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for OptionChainService covering chain construction, put-call parity across rows,
 * synthetic quotes, and the strike selection helpers.
 */
class OptionChainServiceTest {

    private static final double SPOT = 100.0;
    private static final double SIGMA = 0.25;
    private static final int DAYS = 30;

    private OptionChainService optionChainService;
    private PricingConfig pricingConfig;

    @BeforeEach
    void setUp() {
        StandardNormal normal = new StandardNormal();
        BlackScholesPricer pricer = new BlackScholesPricer(normal);
        pricingConfig = new PricingConfig();
        optionChainService = new OptionChainService(pricer, new GreeksCalculator(normal, pricer), pricingConfig);
    }

    @Nested
    @DisplayName("Chain Generation")
    class ChainGeneration {

        @Test
        @DisplayName("One row per strike, in input order, with chain metadata")
        void rowsFollowStrikes() {
            OptionChain chain = optionChainService.generateChain(SPOT, SIGMA, List.of(95.0, 100.0, 105.0), DAYS);

            assertThat(chain.getEntries()).extracting(OptionChainEntry::getStrike).containsExactly(95.0, 100.0, 105.0);
            assertThat(chain.getSpotPrice()).isEqualTo(SPOT);
            assertThat(chain.getVolatility()).isEqualTo(SIGMA);
            assertThat(chain.getDaysToExpiry()).isEqualTo(DAYS);
            assertThat(chain.getRiskFreeRate()).isEqualTo(0.05);
            assertThat(chain.getAtmStrike()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Every row satisfies put-call parity")
        void parityPerRow() {
            List<Double> strikes = new StrikeLadder().chainStrikes(SPOT, 10);
            OptionChain chain = optionChainService.generateChain(SPOT, SIGMA, strikes, DAYS);
            double T = DAYS / 365.0;

            for (OptionChainEntry entry : chain.getEntries()) {
                double lhs = entry.getCall().getPrice() - entry.getPut().getPrice();
                double rhs = SPOT - entry.getStrike() * Math.exp(-0.05 * T);
                assertThat(lhs).as("parity at K=%s", entry.getStrike()).isCloseTo(rhs, within(1e-6));
            }
        }

        @Test
        @DisplayName("Call prices fall and put prices rise with strike")
        void monotonicAcrossStrikes() {
            OptionChain chain =
                    optionChainService.generateChain(SPOT, SIGMA, new StrikeLadder().chainStrikes(SPOT, 5), DAYS);

            List<OptionChainEntry> entries = chain.getEntries();
            for (int i = 1; i < entries.size(); i++) {
                assertThat(entries.get(i).getCall().getPrice()).isLessThan(entries.get(i - 1).getCall().getPrice());
                assertThat(entries.get(i).getPut().getPrice()).isGreaterThan(entries.get(i - 1).getPut().getPrice());
            }
        }

        @Test
        @DisplayName("Moneyness is (S - K) / K in percent and ITM follows the call side")
        void moneyness() {
            OptionChain chain = optionChainService.generateChain(SPOT, SIGMA, List.of(95.0, 100.0, 105.0), DAYS);

            assertThat(chain.getEntries().get(0).getMoneynessPercent()).isCloseTo(5.0 / 95.0 * 100, within(1e-12));
            assertThat(chain.getEntries().get(0).isItm()).isTrue();
            assertThat(chain.getEntries().get(1).isItm()).isFalse();
            assertThat(chain.getEntries().get(2).isItm()).isFalse();
        }

        @Test
        @DisplayName("Bid and ask straddle the theoretical price by the configured spread")
        void syntheticQuotes() {
            pricingConfig.setQuoteSpreadPercent(5.0);
            OptionData call = optionChainService
                    .generateChain(SPOT, SIGMA, List.of(100.0), DAYS)
                    .getEntries()
                    .get(0)
                    .getCall();

            assertThat(call.getBid()).isCloseTo(call.getPrice() * 0.95, within(1e-12));
            assertThat(call.getAsk()).isCloseTo(call.getPrice() * 1.05, within(1e-12));
            assertThat(call.getVolatility()).isEqualTo(SIGMA);
        }

        @Test
        @DisplayName("Explicit rate overrides the configured one")
        void explicitRate() {
            OptionChain chain = optionChainService.generateChain(SPOT, SIGMA, List.of(100.0), DAYS, 0.0);
            OptionChainEntry entry = chain.getEntries().get(0);

            assertThat(chain.getRiskFreeRate()).isEqualTo(0.0);
            assertThat(entry.getCall().getPrice()).isCloseTo(entry.getPut().getPrice(), within(1e-9));
        }

        @Test
        @DisplayName("Empty strike list gives an empty chain")
        void emptyStrikes() {
            OptionChain chain = optionChainService.generateChain(SPOT, SIGMA, List.of(), DAYS);

            assertThat(chain.getEntries()).isEmpty();
            assertThat(chain.getAtmStrike()).isNaN();
        }
    }

    @Nested
    @DisplayName("Invalid Input Handling")
    class InvalidInput {

        @Test
        @DisplayName("Strikes must be present, positive and strictly ascending")
        void badStrikes() {
            assertThatThrownBy(() -> optionChainService.generateChain(SPOT, SIGMA, null, DAYS))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> optionChainService.generateChain(SPOT, SIGMA, List.of(0.0, 100.0), DAYS))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> optionChainService.generateChain(SPOT, SIGMA, List.of(105.0, 100.0), DAYS))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("ascending");
            assertThatThrownBy(() -> optionChainService.generateChain(SPOT, SIGMA, Arrays.asList(95.0, null), DAYS))
                    .isInstanceOf(InvalidInputException.class);
        }

        @Test
        @DisplayName("Non-positive spot and negative days are rejected")
        void badSpotOrDays() {
            assertThatThrownBy(() -> optionChainService.generateChain(0, SIGMA, List.of(100.0), DAYS))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> optionChainService.generateChain(SPOT, SIGMA, List.of(100.0), -1))
                    .isInstanceOf(InvalidInputException.class);
        }

        @Test
        @DisplayName("Bad spot, days or volatility are rejected even with no strikes to price")
        void badInputsWithEmptyStrikes() {
            assertThatThrownBy(() -> optionChainService.generateChain(-100, SIGMA, List.of(), DAYS))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("spot");
            assertThatThrownBy(() -> optionChainService.generateChain(SPOT, SIGMA, List.of(), -5))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("daysToExpiry");
            assertThatThrownBy(() -> optionChainService.generateChain(SPOT, Double.NaN, List.of(), DAYS))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("volatility");
        }
    }

    @Nested
    @DisplayName("Strike Selection")
    class StrikeSelection {

        @Test
        @DisplayName("ATM strike is the nearest strike, ties to the lower one")
        void findAtm() {
            assertThat(optionChainService.findATMStrike(101.0, List.of(95.0, 100.0, 105.0))).isEqualTo(100.0);
            assertThat(optionChainService.findATMStrike(102.5, List.of(100.0, 105.0))).isEqualTo(100.0);
            assertThat(optionChainService.findATMStrike(100.0, List.of())).isNaN();
        }

        @Test
        @DisplayName("Offset walks the chain from ATM and returns null out of range")
        void strikeByOffset() {
            OptionChain chain = optionChainService.generateChain(SPOT, SIGMA, List.of(95.0, 100.0, 105.0), DAYS);

            assertThat(optionChainService.getStrikeByOffset(chain, 0)).isEqualTo(100.0);
            assertThat(optionChainService.getStrikeByOffset(chain, 1)).isEqualTo(105.0);
            assertThat(optionChainService.getStrikeByOffset(chain, -1)).isEqualTo(95.0);
            assertThat(optionChainService.getStrikeByOffset(chain, 2)).isNull();
            assertThat(optionChainService.getStrikeByOffset(null, 0)).isNull();
        }

        @Test
        @DisplayName("Delta search picks the closest absolute delta")
        void findByDelta() {
            OptionChain chain =
                    optionChainService.generateChain(SPOT, SIGMA, new StrikeLadder().chainStrikes(SPOT, 10), DAYS);

            OptionData atmCall = optionChainService.findByDelta(chain, 0.5, OptionType.CALL);
            OptionData wingPut = optionChainService.findByDelta(chain, -0.2, OptionType.PUT);

            assertThat(atmCall.getStrike()).isEqualTo(100.0);
            assertThat(wingPut.getOptionType()).isEqualTo(OptionType.PUT);
            assertThat(wingPut.getStrike()).isLessThan(SPOT);
            assertThat(Math.abs(wingPut.getGreeks().getDelta())).isCloseTo(0.2, within(0.1));
        }
    }
}
