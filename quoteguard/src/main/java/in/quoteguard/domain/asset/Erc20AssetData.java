package in.quoteguard.domain.asset;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decoder for ERC-20 asset data.
 *
 * Layout: 4-byte proxy id 0xf47261b0, then the token address left-padded to a 32-byte word.
 */
public final class Erc20AssetData {

    public static final String ERC20_PROXY_ID = "f47261b0";

    private static final Pattern HEX = Pattern.compile("^[0-9a-f]*$");
    private static final int PROXY_ID_CHARS = 8;
    private static final int WORD_CHARS = 64;
    private static final int ADDRESS_CHARS = 40;

    /**
     * Extract the token address from ERC-20 asset data.
     *
     * @param assetData hex string, with or without 0x prefix
     * @return lower-cased 0x-prefixed token address
     * @throws IllegalArgumentException if the data is not well-formed ERC-20 asset data
     */
    public static String decodeTokenAddress(String assetData) {
        if (assetData == null) {
            throw new IllegalArgumentException("Asset data cannot be null");
        }

        String hex = assetData.toLowerCase(Locale.ROOT);
        if (hex.startsWith("0x")) {
            hex = hex.substring(2);
        }

        if (hex.length() != PROXY_ID_CHARS + WORD_CHARS) {
            throw new IllegalArgumentException("Invalid ERC-20 asset data length: " + assetData);
        }
        if (!HEX.matcher(hex).matches()) {
            throw new IllegalArgumentException("Asset data is not hex: " + assetData);
        }

        String proxyId = hex.substring(0, PROXY_ID_CHARS);
        if (!ERC20_PROXY_ID.equals(proxyId)) {
            throw new IllegalArgumentException("Unsupported asset proxy id 0x" + proxyId + ", expected ERC-20");
        }

        String word = hex.substring(PROXY_ID_CHARS);
        String padding = word.substring(0, WORD_CHARS - ADDRESS_CHARS);
        for (int i = 0; i < padding.length(); i++) {
            if (padding.charAt(i) != '0') {
                throw new IllegalArgumentException("Token address word has non-zero padding: " + assetData);
            }
        }

        return "0x" + word.substring(WORD_CHARS - ADDRESS_CHARS);
    }

    /**
     * Encode a token address as ERC-20 asset data.
     */
    public static String encode(String tokenAddress) {
        if (tokenAddress == null) {
            throw new IllegalArgumentException("Token address cannot be null");
        }
        String hex = tokenAddress.toLowerCase(Locale.ROOT);
        if (hex.startsWith("0x")) {
            hex = hex.substring(2);
        }
        if (hex.length() != ADDRESS_CHARS || !HEX.matcher(hex).matches()) {
            throw new IllegalArgumentException("Invalid token address: " + tokenAddress);
        }
        return "0x" + ERC20_PROXY_ID + "0".repeat(WORD_CHARS - ADDRESS_CHARS) + hex;
    }

    private Erc20AssetData() {}
}
