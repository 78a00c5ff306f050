package com.hyperagi.nacosagent.validation;

import org.bouncycastle.crypto.digests.KeccakDigest;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 以太坊钱包地址校验
 * <p>
 * 格式为 0x + 40 位十六进制；全小写或全大写不校验大小写，
 * 大小写混合时必须符合 EIP-55 校验和
 */
public final class WalletAddressValidator {

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private WalletAddressValidator() {
    }

    public static boolean isValid(String address) {
        if (address == null || !ADDRESS_PATTERN.matcher(address).matches()) {
            return false;
        }

        String hex = address.substring(2);
        String lower = hex.toLowerCase(Locale.ROOT);
        String upper = hex.toUpperCase(Locale.ROOT);
        if (hex.equals(lower) || hex.equals(upper)) {
            return true;
        }
        return address.equals(toChecksumAddress(address));
    }

    /**
     * 计算 EIP-55 校验和格式的地址
     *
     * @param address 0x 开头的 40 位十六进制地址（大小写不限）
     * @return 校验和格式地址
     */
    public static String toChecksumAddress(String address) {
        if (address == null || !ADDRESS_PATTERN.matcher(address).matches()) {
            throw new IllegalArgumentException("无效的钱包地址格式: " + address);
        }

        String lower = address.substring(2).toLowerCase(Locale.ROOT);
        String hash = keccak256Hex(lower.getBytes(StandardCharsets.US_ASCII));

        StringBuilder result = new StringBuilder("0x");
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            // 对应哈希半字节 >= 8 的字母位大写
            if (Character.isLetter(c) && Character.digit(hash.charAt(i), 16) >= 8) {
                result.append(Character.toUpperCase(c));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    private static String keccak256Hex(byte[] input) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return Hex.toHexString(out);
    }
}
