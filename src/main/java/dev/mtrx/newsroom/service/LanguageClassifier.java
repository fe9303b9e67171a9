package dev.mtrx.newsroom.service;

import dev.mtrx.newsroom.dto.LanguageClassification;
import dev.mtrx.newsroom.dto.LanguageClassification.Method;
import dev.mtrx.newsroom.entity.Article;
import dev.mtrx.newsroom.util.HtmlUtils;
import dev.mtrx.newsroom.util.LanguageNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decides an article's language from its own text, using the feed's declared language as a hint.
 * <p>
 * Short or empty bodies are never trusted: they fall back to the hint and are flagged for manual review.
 * Longer bodies go through script analysis (Arabic, Chinese, Japanese) and then stop-word scoring
 * (English, French, Spanish, Portuguese). A detection that disagrees with the hint is flagged
 * unless it clears the high-confidence cutoff.
 * <p>
 * Stateless and deterministic; safe to call from any thread.
 */
@Slf4j
@Service
public class LanguageClassifier {

    private static final int MIN_STOP_WORD_HITS = 3;
    private static final double EVIDENCE_SATURATION = 20.0;
    private static final double SCRIPT_SHARE_THRESHOLD = 0.3;
    private static final double KANA_SHARE_THRESHOLD = 0.1;

    // Words shared between the Romance languages ("de", "la", "que", "para", "por", "se") are left out
    private static final Map<String, Set<String>> STOP_WORDS = buildStopWords();

    private final int minTextLength;
    private final double minConfidence;
    private final double highConfidence;

    public LanguageClassifier(
            @Value("${pipeline.language.min-text-length:100}") int minTextLength,
            @Value("${pipeline.language.min-confidence:0.6}") double minConfidence,
            @Value("${pipeline.language.high-confidence:0.9}") double highConfidence) {
        this.minTextLength = minTextLength;
        this.minConfidence = minConfidence;
        this.highConfidence = highConfidence;
    }

    public LanguageClassification classify(Article article, String feedLanguageHint) {
        String text = HtmlUtils.joinPlainText(article.getDescription(), article.getContent());
        String hint = LanguageNames.normalize(feedLanguageHint).orElse(null);

        if (text.isEmpty()) {
            return LanguageClassification.undetermined();
        }
        if (text.length() < minTextLength) {
            log.debug("Text too short for detection ({} chars), using feed hint {}", text.length(), hint);
            return LanguageClassification.fromHint(hint);
        }

        LanguageClassification detected = detectByScript(text);
        if (detected == null) {
            detected = detectByStopWords(text);
        }
        if (detected == null) {
            log.debug("No language evidence in {} chars, using feed hint {}", text.length(), hint);
            return LanguageClassification.fromHint(hint);
        }

        boolean review = detected.confidence() < minConfidence;
        if (hint != null && !hint.equals(detected.language()) && detected.confidence() < highConfidence) {
            log.debug("Detected {} ({}) disagrees with feed hint {}", detected.language(),
                    detected.confidence(), hint);
            review = true;
        }
        return new LanguageClassification(detected.language(), review, detected.confidence(), detected.method());
    }

    LanguageClassification detectByScript(String text) {
        int letters = 0;
        int arabic = 0;
        int han = 0;
        int kana = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            if (!Character.isLetter(cp)) continue;
            letters++;
            Character.UnicodeScript script = Character.UnicodeScript.of(cp);
            switch (script) {
                case ARABIC -> arabic++;
                case HAN -> han++;
                case HIRAGANA, KATAKANA -> kana++;
                default -> { }
            }
        }
        if (letters == 0) return null;

        double kanaShare = (double) kana / letters;
        double cjkShare = (double) (kana + han) / letters;
        double arabicShare = (double) arabic / letters;

        if (kanaShare >= KANA_SHARE_THRESHOLD) {
            return scriptResult(LanguageNames.JAPANESE, cjkShare);
        }
        if ((double) han / letters >= SCRIPT_SHARE_THRESHOLD) {
            return scriptResult(LanguageNames.CHINESE, cjkShare);
        }
        if (arabicShare >= SCRIPT_SHARE_THRESHOLD) {
            return scriptResult(LanguageNames.ARABIC, arabicShare);
        }
        return null;
    }

    LanguageClassification detectByStopWords(String text) {
        Map<String, Integer> hits = new LinkedHashMap<>();
        STOP_WORDS.keySet().forEach(language -> hits.put(language, 0));

        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}]+")) {
            if (token.isEmpty()) continue;
            STOP_WORDS.forEach((language, words) -> {
                if (words.contains(token)) {
                    hits.merge(language, 1, Integer::sum);
                }
            });
        }

        String winner = null;
        int top = 0;
        int total = 0;
        for (Map.Entry<String, Integer> entry : hits.entrySet()) {
            total += entry.getValue();
            if (entry.getValue() > top) {
                top = entry.getValue();
                winner = entry.getKey();
            }
        }
        if (winner == null || top < MIN_STOP_WORD_HITS) return null;

        double share = (double) top / total;
        double evidence = Math.min(1.0, top / EVIDENCE_SATURATION);
        double confidence = round(share * (0.5 + 0.5 * evidence));
        return new LanguageClassification(winner, false, confidence, Method.STOP_WORDS);
    }

    private static LanguageClassification scriptResult(String language, double share) {
        return new LanguageClassification(language, false, round(Math.min(0.99, 0.5 + share / 2)), Method.SCRIPT);
    }

    private static double round(double value) {
        return Math.round(value * 1000) / 1000.0;
    }

    private static Map<String, Set<String>> buildStopWords() {
        Map<String, Set<String>> words = new LinkedHashMap<>();
        words.put(LanguageNames.ENGLISH, Set.of(
                "the", "and", "of", "to", "is", "that", "for", "with", "was", "are", "by", "this", "from",
                "have", "has", "it", "be", "were", "which", "their", "they", "will", "would", "been", "not",
                "but", "an", "at", "or", "its", "after", "said", "in"));
        words.put(LanguageNames.FRENCH, Set.of(
                "le", "les", "des", "est", "et", "une", "dans", "pour", "qui", "sur", "pas", "avec", "du",
                "au", "aux", "ce", "cette", "sont", "par", "plus", "ont", "été", "nous", "leur", "leurs",
                "elle", "il", "ils", "ses", "aussi", "selon", "depuis", "très", "être", "fait", "sans", "comme"));
        words.put(LanguageNames.SPANISH, Set.of(
                "el", "los", "las", "del", "y", "es", "con", "una", "al", "más", "pero", "sus", "su", "fue",
                "han", "también", "según", "muy", "ya", "hay", "cuando", "donde", "lo", "sino", "año",
                "años", "hoy", "ahora"));
        words.put(LanguageNames.PORTUGUESE, Set.of(
                "o", "os", "do", "da", "dos", "das", "não", "em", "um", "uma", "com", "ao", "pelo", "pela",
                "foi", "são", "também", "ele", "eles", "seu", "sua", "muito", "já", "há", "isso", "essa",
                "esse", "quando", "onde", "ainda", "agora", "anos", "hoje", "na", "nas"));
        return words;
    }
}
