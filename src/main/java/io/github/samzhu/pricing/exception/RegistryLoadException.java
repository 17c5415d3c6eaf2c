package io.github.samzhu.pricing.exception;

/**
 * Registry 檔案載入失敗（格式錯誤、schema 驗證失敗、重複的模型 ID）。
 *
 * <p>此異常在啟動或首次讀取供應商資料時拋出，不會以降級狀態繼續提供服務。
 */
public class RegistryLoadException extends RuntimeException {

    private final String filename;

    public RegistryLoadException(String filename, String message) {
        super(message);
        this.filename = filename;
    }

    public RegistryLoadException(String filename, String message, Throwable cause) {
        super(message, cause);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
