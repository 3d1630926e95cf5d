package Model;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Available {@link ImageIndex} storage backends. Both answer every query
 * identically.
 */
public enum IndexBackend {

    H2 {
        @Override
        public ImageIndex open(Path location, FingerprintSettings settings) {
            return new H2ImageIndex(location, settings);
        }
    },

    TABLE {
        @Override
        public ImageIndex open(Path location, FingerprintSettings settings) {
            return new TableImageIndex(location, settings);
        }
    };

    public abstract ImageIndex open(Path location, FingerprintSettings settings);

    public static IndexBackend fromKey(String key) {
        try {
            return valueOf(key.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid backend '" + key + "' - expected h2 or table", e);
        }
    }
}
