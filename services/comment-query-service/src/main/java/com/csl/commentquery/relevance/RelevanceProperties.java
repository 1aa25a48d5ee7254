package com.csl.commentquery.relevance;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "comment-query.search")
public class RelevanceProperties {
    private List<String> defaultFields = new ArrayList<>(List.of(
        "comment_author",
        "comment_author_email",
        "comment_author_url",
        "comment_author_IP",
        "comment_content"
    ));
    private double phraseBoost = 4;
    private double matchBoost = 2;
    private int fuzziness = 1;

    public List<String> getDefaultFields() {
        return defaultFields;
    }

    public void setDefaultFields(List<String> defaultFields) {
        this.defaultFields = defaultFields;
    }

    public double getPhraseBoost() {
        return phraseBoost;
    }

    public void setPhraseBoost(double phraseBoost) {
        this.phraseBoost = phraseBoost;
    }

    public double getMatchBoost() {
        return matchBoost;
    }

    public void setMatchBoost(double matchBoost) {
        this.matchBoost = matchBoost;
    }

    public int getFuzziness() {
        return fuzziness;
    }

    public void setFuzziness(int fuzziness) {
        this.fuzziness = fuzziness;
    }
}
