package io.github.hide212131.skillpkg.config;

/** skillpkg.json の読み書きに失敗したことを示す。 */
public class ManifestException extends RuntimeException {

    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
