package in.quoteguard.application.port.input;

import in.quoteguard.domain.model.Quote;

import java.math.BigDecimal;
import java.util.List;

/**
 * Checks a batch of firm quotes against what the makers actually hold.
 */
public interface FirmQuoteValidator {

    /**
     * Compute the taker fillable amount of each quote.
     *
     * @param quotes quotes of one request, all for the same maker asset
     * @return one amount per quote, same order as the input
     * @throws in.quoteguard.application.port.output.CacheStorageException if the balance cache cannot be read
     */
    List<BigDecimal> computeFillableAmounts(List<Quote> quotes);
}
