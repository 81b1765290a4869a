package in.quoteguard.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import in.quoteguard.domain.model.Quote;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON mapping for quote batches and fillable amounts.
 *
 * Input is an array of objects with makerAddress, makerAssetAmount, takerAssetAmount and either
 * makerAssetData (ERC-20 asset data) or makerAssetAddress. Amounts are decimal strings or numbers.
 * Output amounts are plain decimal strings so large integers survive JavaScript clients.
 */
public final class QuoteJsonMapper {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * @throws IllegalArgumentException if the JSON is malformed or a quote is invalid
     */
    public static List<Quote> readQuotes(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid quotes JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Quotes JSON must be an array");
        }

        List<Quote> quotes = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            quotes.add(readQuote(root.get(i), i));
        }
        return quotes;
    }

    public static String writeAmounts(List<BigDecimal> amounts) {
        ArrayNode array = MAPPER.createArrayNode();
        for (BigDecimal amount : amounts) {
            array.add(amount.toPlainString());
        }
        return array.toString();
    }

    private static Quote readQuote(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Quote " + index + " is not an object");
        }

        String makerAddress = requireText(node, "makerAddress", index);
        BigDecimal makerAssetAmount = requireDecimal(node, "makerAssetAmount", index);
        BigDecimal takerAssetAmount = requireDecimal(node, "takerAssetAmount", index);

        if (node.hasNonNull("makerAssetData")) {
            String assetData = requireText(node, "makerAssetData", index);
            return Quote.fromAssetData(makerAddress, assetData, makerAssetAmount, takerAssetAmount);
        }
        String makerAssetAddress = requireText(node, "makerAssetAddress", index);
        return new Quote(makerAddress, makerAssetAddress, makerAssetAmount, takerAssetAmount);
    }

    private static String requireText(JsonNode node, String field, int index) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new IllegalArgumentException("Quote " + index + ": missing " + field);
        }
        return value.asText();
    }

    private static BigDecimal requireDecimal(JsonNode node, String field, int index) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Quote " + index + ": missing " + field);
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        try {
            return new BigDecimal(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Quote " + index + ": " + field + " is not a decimal: " + value.asText(), e);
        }
    }

    private QuoteJsonMapper() {}
}
