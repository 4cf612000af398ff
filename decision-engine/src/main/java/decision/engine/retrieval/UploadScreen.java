package decision.engine.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

@Component
public class UploadScreen {
    private static final Logger log = LoggerFactory.getLogger(UploadScreen.class);

    static final List<String> DANGEROUS_PATTERNS = List.of("<script>", "javascript:", "eval(", "exec(");

    private final long maxBytes;

    public UploadScreen(@Value("${decision.engine.upload.max-bytes:10485760}") long maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalStateException("upload max-bytes must be positive: " + maxBytes);
        }
        this.maxBytes = maxBytes;
    }

    public void check(String filename, byte[] content) {
        if (content == null) {
            return;
        }
        if (content.length > maxBytes) {
            log.warn("event=upload_rejected reason=too_large filename={} bytes={} max_bytes={}",
                    filename, content.length, maxBytes);
            throw new IllegalArgumentException("file exceeds the maximum upload size of " + maxBytes + " bytes");
        }
        // byte-for-byte decoding keeps the ASCII markers findable in binary content
        String lowered = new String(content, StandardCharsets.ISO_8859_1).toLowerCase(Locale.ROOT);
        for (String pattern : DANGEROUS_PATTERNS) {
            if (lowered.contains(pattern)) {
                log.warn("event=upload_rejected reason=suspicious_content filename={} pattern={}", filename, pattern);
                throw new IllegalArgumentException("suspicious content detected");
            }
        }
    }
}
