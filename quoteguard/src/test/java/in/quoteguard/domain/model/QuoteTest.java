package in.quoteguard.domain.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class QuoteTest {

    private static final String MAKER = "0x000000000000000000000000000000000000000a";
    private static final String TOKEN = "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2";

    @Test
    void fromAssetDataDerivesMakerAssetAddress() {
        Quote quote = Quote.fromAssetData(MAKER,
            "0xf47261b0000000000000000000000000C02AAA39B223FE8D0A0E5C4F27EAD9083C756CC2",
            BigDecimal.TEN, BigDecimal.ONE);

        assertEquals(TOKEN, quote.makerAssetAddress());
        assertEquals(MAKER, quote.makerAddress());
    }

    @Test
    void makerAssetAddressIsLowerCased() {
        Quote quote = new Quote(MAKER, "0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2", BigDecimal.TEN, BigDecimal.ONE);

        assertEquals(TOKEN, quote.makerAssetAddress());
    }

    @Test
    void rejectsNegativeAmounts() {
        assertThrows(IllegalArgumentException.class,
            () -> new Quote(MAKER, TOKEN, new BigDecimal("-1"), BigDecimal.ONE));
        assertThrows(IllegalArgumentException.class,
            () -> new Quote(MAKER, TOKEN, BigDecimal.ONE, new BigDecimal("-0.5")));
    }

    @Test
    void rejectsMissingFields() {
        assertThrows(IllegalArgumentException.class, () -> new Quote(null, TOKEN, BigDecimal.ONE, BigDecimal.ONE));
        assertThrows(IllegalArgumentException.class, () -> new Quote(MAKER, "", BigDecimal.ONE, BigDecimal.ONE));
        assertThrows(IllegalArgumentException.class, () -> new Quote(MAKER, TOKEN, null, BigDecimal.ONE));
    }
}
