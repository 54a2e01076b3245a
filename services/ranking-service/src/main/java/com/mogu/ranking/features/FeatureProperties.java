package com.mogu.ranking.features;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

// List order fixes the slot of each value in the vector.
@ConfigurationProperties(prefix = "ranking.features")
public class FeatureProperties {
    private List<String> categories = new ArrayList<>(List.of(
        "생활용품",
        "식품/간식류",
        "패션/잡화",
        "뷰티/헬스케어"
    ));
    private List<String> markets = new ArrayList<>(List.of(
        "코스트코",
        "이마트",
        "트레이더스",
        "노브랜드",
        "편의점",
        "홈플러스",
        "동네마켓",
        "전통시장",
        "이커머스",
        "기타"
    ));

    public List<String> getCategories() {
        return categories;
    }

    public void setCategories(List<String> categories) {
        this.categories = categories;
    }

    public List<String> getMarkets() {
        return markets;
    }

    public void setMarkets(List<String> markets) {
        this.markets = markets;
    }
}
