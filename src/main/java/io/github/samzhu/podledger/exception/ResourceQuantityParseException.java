package io.github.samzhu.podledger.exception;

/**
 * 資源數量字串解析異常。
 *
 * <p>當 Pod 的 resource request 無法解析為數值時拋出，例如 {@code "abc"}。
 *
 * <p>處理方式：
 * <ul>
 *   <li>僅中止該 Pod 的資源計算，不影響串流迴圈或對帳流程</li>
 *   <li>呼叫端記錄錯誤後略過該 Pod</li>
 * </ul>
 */
public class ResourceQuantityParseException extends RuntimeException {

    private final String quantity;

    public ResourceQuantityParseException(String quantity) {
        super(String.format("Unable to parse resource quantity: '%s'", quantity));
        this.quantity = quantity;
    }

    public String getQuantity() {
        return quantity;
    }
}
