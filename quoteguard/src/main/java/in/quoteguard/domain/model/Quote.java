package in.quoteguard.domain.model;

import in.quoteguard.domain.asset.Erc20AssetData;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * A maker's signed offer, reduced to the fields the balance check needs.
 *
 * makerAssetAddress is stored lower-case so checksummed and plain spellings of one token share a cache key.
 */
public record Quote(
    String makerAddress,
    String makerAssetAddress,
    BigDecimal makerAssetAmount,
    BigDecimal takerAssetAmount
) {
    public Quote {
        if (makerAddress == null || makerAddress.isEmpty()) {
            throw new IllegalArgumentException("makerAddress cannot be empty");
        }
        if (makerAssetAddress == null || makerAssetAddress.isEmpty()) {
            throw new IllegalArgumentException("makerAssetAddress cannot be empty");
        }
        makerAssetAddress = makerAssetAddress.toLowerCase(Locale.ROOT);
        if (makerAssetAmount == null || takerAssetAmount == null) {
            throw new IllegalArgumentException("makerAssetAmount and takerAssetAmount cannot be null");
        }
        if (makerAssetAmount.signum() < 0 || takerAssetAmount.signum() < 0) {
            throw new IllegalArgumentException("Asset amounts cannot be negative");
        }
    }

    /**
     * Build a quote from raw ERC-20 maker asset data.
     *
     * @throws IllegalArgumentException if the asset data is not ERC-20 asset data
     */
    public static Quote fromAssetData(String makerAddress, String makerAssetData,
                                      BigDecimal makerAssetAmount, BigDecimal takerAssetAmount) {
        return new Quote(
            makerAddress,
            Erc20AssetData.decodeTokenAddress(makerAssetData),
            makerAssetAmount,
            takerAssetAmount
        );
    }
}
