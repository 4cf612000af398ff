package decision.engine.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

@Component
public class PlainTextExtractor implements TextExtractor {
    private static final Logger log = LoggerFactory.getLogger(PlainTextExtractor.class);

    @Override
    public String extract(byte[] content) {
        if (content == null || content.length == 0) {
            return "";
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            log.warn("event=text_extraction_failed bytes={} error={}", content.length, e.toString());
            return "";
        }
        return text.replaceAll("[\\p{Cntrl}&&[^\\n\\r\\t]]", "").strip();
    }
}
