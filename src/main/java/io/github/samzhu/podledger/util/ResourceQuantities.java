package io.github.samzhu.podledger.util;

import java.math.BigDecimal;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.github.samzhu.podledger.exception.ResourceQuantityParseException;

/**
 * Kubernetes 資源數量 (resource quantity) 解析工具類。
 *
 * <p>將帶單位的字串轉換為不含單位的基本數值：
 * <ul>
 *   <li>記憶體 → bytes（{@code "2Gi"} = 2 × 2<sup>30</sup>）</li>
 *   <li>CPU → cores（{@code "250m"} = 0.25）</li>
 * </ul>
 *
 * <p>支援的單位：
 * <pre>
 * 二進位：Ki Mi Gi Ti Pi Ei = 2^10 .. 2^60
 * 十進位：K(k) M G T P E   = 10^3 .. 10^18
 * 毫：    m                = 10^-3
 * </pre>
 *
 * @see <a href="https://kubernetes.io/docs/reference/kubernetes-api/common-definitions/quantity/">Quantity</a>
 */
public final class ResourceQuantities {

    private static final Pattern QUANTITY = Pattern.compile("([0-9]+(?:\\.[0-9]+)?)(m|Ki|Mi|Gi|Ti|Pi|Ei|k|K|M|G|T|P|E)?");

    private static final Map<String, BigDecimal> SUFFIXES = Map.ofEntries(
        Map.entry("Ki", BigDecimal.valueOf(2).pow(10)),
        Map.entry("Mi", BigDecimal.valueOf(2).pow(20)),
        Map.entry("Gi", BigDecimal.valueOf(2).pow(30)),
        Map.entry("Ti", BigDecimal.valueOf(2).pow(40)),
        Map.entry("Pi", BigDecimal.valueOf(2).pow(50)),
        Map.entry("Ei", BigDecimal.valueOf(2).pow(60)),
        Map.entry("m", new BigDecimal("0.001")),
        Map.entry("k", BigDecimal.TEN.pow(3)),
        Map.entry("K", BigDecimal.TEN.pow(3)),
        Map.entry("M", BigDecimal.TEN.pow(6)),
        Map.entry("G", BigDecimal.TEN.pow(9)),
        Map.entry("T", BigDecimal.TEN.pow(12)),
        Map.entry("P", BigDecimal.TEN.pow(15)),
        Map.entry("E", BigDecimal.TEN.pow(18))
    );

    private ResourceQuantities() {
        // 工具類不允許實例化
    }

    /**
     * 解析資源數量字串。
     *
     * @param quantity 資源數量，例如 {@code "500m"}、{@code "1Gi"}；null 或空字串視為 0
     * @return 不含單位的數值
     * @throws ResourceQuantityParseException 字串格式不符
     */
    public static BigDecimal parse(String quantity) {
        if (quantity == null || quantity.isEmpty() || "0".equals(quantity)) {
            return BigDecimal.ZERO;
        }

        Matcher matcher = QUANTITY.matcher(quantity);
        if (!matcher.matches()) {
            throw new ResourceQuantityParseException(quantity);
        }

        BigDecimal value = new BigDecimal(matcher.group(1));
        String unit = matcher.group(2);
        if (unit == null) {
            return value;
        }
        return value.multiply(SUFFIXES.get(unit));
    }
}
