package io.github.samzhu.pricing.exception;

/**
 * 對外穩定的錯誤代碼及其預設 HTTP 狀態碼。
 */
public enum ErrorCode {

    /** 用量、幣別、模式或 override 格式錯誤。 */
    INVALID_REQUEST(400),
    /** 別名解析後仍找不到的供應商。 */
    PROVIDER_NOT_SUPPORTED(400),
    /** 已知供應商下找不到的模型。 */
    MODEL_NOT_FOUND(400),
    /** 請求的定價版本既不是 {@code latest} 也不是目前版本。 */
    PRICING_VERSION_NOT_FOUND(400),
    /** strict 模式下沒有費率的維度。 */
    UNSUPPORTED_DIMENSION(400),
    /** 非預期錯誤，不對外揭露內部細節。 */
    INTERNAL_ERROR(500);

    private final int status;

    ErrorCode(int status) {
        this.status = status;
    }

    public int status() {
        return status;
    }
}
