package com.studysnap.layout.config;

import com.studysnap.layout.cards.CardCategory;
import com.studysnap.layout.classification.ClassificationRule;
import com.studysnap.layout.classification.PositionRule;
import com.studysnap.layout.layout.PageType;
import com.studysnap.layout.model.FontStyle;
import com.studysnap.layout.model.ObjectType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "layout.engine")
public class LayoutEngineProperties implements InitializingBean {

  private static final double MAX_ZONE_RATIO = 0.5d;

  private final Classifier classifier = new Classifier();
  private final Layout layout = new Layout();
  private final Cards cards = new Cards();
  private final Synthesis synthesis = new Synthesis();

  @Override
  public void afterPropertiesSet() {
    classifier.validate();
    layout.validate();
    cards.validate();
    synthesis.validate();
  }

  public Classifier getClassifier() {
    return classifier;
  }

  public Layout getLayout() {
    return layout;
  }

  public Cards getCards() {
    return cards;
  }

  public Synthesis getSynthesis() {
    return synthesis;
  }

  public static class Classifier {
    private double pageHeight = 842.0d;
    private int maxFragments = 10_000;
    private List<RuleDefinition> rules = new ArrayList<>();

    public void validate() {
      if (pageHeight <= 0) {
        throw new IllegalStateException(
            "layout.engine.classifier.pageHeight must be positive but was " + pageHeight);
      }
      if (maxFragments < 1) {
        throw new IllegalStateException(
            "layout.engine.classifier.maxFragments must be at least 1 but was " + maxFragments);
      }
      for (RuleDefinition rule : rules) {
        rule.toRule();
      }
    }

    public double getPageHeight() {
      return pageHeight;
    }

    public void setPageHeight(double pageHeight) {
      this.pageHeight = pageHeight;
    }

    public int getMaxFragments() {
      return maxFragments;
    }

    public void setMaxFragments(int maxFragments) {
      this.maxFragments = maxFragments;
    }

    public List<RuleDefinition> getRules() {
      return rules;
    }

    public void setRules(List<RuleDefinition> rules) {
      this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }
  }

  /** Bindable form of a {@link ClassificationRule}; patterns are compiled by {@link #toRule()}. */
  public static class RuleDefinition {
    private String name;
    private ObjectType targetType;
    private int priority;
    private Double minFontSize;
    private Double maxFontSize;
    private FontStyle fontStyle;
    private String colorPattern;
    private String contentPattern;
    private PositionRule positionRule;
    private double baseConfidence = 0.8d;

    public ClassificationRule toRule() {
      if (!StringUtils.hasText(name)) {
        throw new IllegalStateException("Classification rule name must not be blank");
      }
      if (targetType == null) {
        throw new IllegalStateException(
            "Classification rule '%s' must declare a targetType".formatted(name));
      }
      ClassificationRule.Builder builder =
          ClassificationRule.builder(name.trim(), targetType, priority)
              .fontStyle(fontStyle)
              .position(positionRule)
              .baseConfidence(baseConfidence);
      if (minFontSize != null) {
        builder.minFontSize(minFontSize);
      }
      if (maxFontSize != null) {
        builder.maxFontSize(maxFontSize);
      }
      if (StringUtils.hasText(colorPattern)) {
        builder.colorPattern(colorPattern);
      }
      if (StringUtils.hasText(contentPattern)) {
        builder.contentPattern(contentPattern);
      }
      return builder.build();
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public ObjectType getTargetType() {
      return targetType;
    }

    public void setTargetType(ObjectType targetType) {
      this.targetType = targetType;
    }

    public int getPriority() {
      return priority;
    }

    public void setPriority(int priority) {
      this.priority = priority;
    }

    public Double getMinFontSize() {
      return minFontSize;
    }

    public void setMinFontSize(Double minFontSize) {
      this.minFontSize = minFontSize;
    }

    public Double getMaxFontSize() {
      return maxFontSize;
    }

    public void setMaxFontSize(Double maxFontSize) {
      this.maxFontSize = maxFontSize;
    }

    public FontStyle getFontStyle() {
      return fontStyle;
    }

    public void setFontStyle(FontStyle fontStyle) {
      this.fontStyle = fontStyle;
    }

    public String getColorPattern() {
      return colorPattern;
    }

    public void setColorPattern(String colorPattern) {
      this.colorPattern = colorPattern;
    }

    public String getContentPattern() {
      return contentPattern;
    }

    public void setContentPattern(String contentPattern) {
      this.contentPattern = contentPattern;
    }

    public PositionRule getPositionRule() {
      return positionRule;
    }

    public void setPositionRule(PositionRule positionRule) {
      this.positionRule = positionRule;
    }

    public double getBaseConfidence() {
      return baseConfidence;
    }

    public void setBaseConfidence(double baseConfidence) {
      this.baseConfidence = baseConfidence;
    }
  }

  public static class Layout {
    private double columnThreshold = 50.0d;
    private double groupThreshold = 30.0d;
    private double headerZoneRatio = 0.1d;
    private double footerZoneRatio = 0.1d;
    private double overlapThreshold = 0.5d;
    private int coverMaxFragments = 5;
    private int minKeywordHits = 2;
    private List<PageType> pageTypeOrder =
        new ArrayList<>(
            List.of(PageType.PROFILE, PageType.PLEDGE, PageType.ACHIEVEMENT, PageType.CONTACT));
    private Map<PageType, List<String>> pageTypeKeywords = defaultPageTypeKeywords();
    private List<String> contactKeywords =
        new ArrayList<>(List.of("연락처", "전화", "사무소", "이메일", "홈페이지", "카카오톡", "TEL", "E-mail"));

    private static Map<PageType, List<String>> defaultPageTypeKeywords() {
      Map<PageType, List<String>> keywords = new EnumMap<>(PageType.class);
      keywords.put(
          PageType.PROFILE, List.of("학력", "경력", "약력", "프로필", "졸업", "前", "現", "출생"));
      keywords.put(
          PageType.PLEDGE, List.of("공약", "약속", "추진", "실현", "만들겠습니다", "하겠습니다"));
      keywords.put(
          PageType.ACHIEVEMENT, List.of("실적", "성과", "바꾼", "완료", "유치", "확보", "개통", "달성"));
      keywords.put(
          PageType.CONTACT, List.of("연락처", "전화", "사무소", "이메일", "홈페이지", "후원"));
      return keywords;
    }

    public void validate() {
      requireNonNegative(columnThreshold, "layout.columnThreshold");
      requireNonNegative(groupThreshold, "layout.groupThreshold");
      requireRatio(headerZoneRatio, "layout.headerZoneRatio");
      requireRatio(footerZoneRatio, "layout.footerZoneRatio");
      if (overlapThreshold < 0 || overlapThreshold > 1) {
        throw new IllegalStateException(
            "layout.engine.layout.overlapThreshold must be between 0 and 1 but was "
                + overlapThreshold);
      }
      requireNonNegative(coverMaxFragments, "layout.coverMaxFragments");
      if (minKeywordHits < 1) {
        throw new IllegalStateException(
            "layout.engine.layout.minKeywordHits must be at least 1 but was " + minKeywordHits);
      }
      if (pageTypeOrder.isEmpty()) {
        throw new IllegalStateException("layout.engine.layout.pageTypeOrder must not be empty");
      }
      for (PageType type : pageTypeOrder) {
        requireKeywords(pageTypeKeywords.get(type), "layout.pageTypeKeywords." + type.label());
      }
      requireKeywords(contactKeywords, "layout.contactKeywords");
    }

    public double getColumnThreshold() {
      return columnThreshold;
    }

    public void setColumnThreshold(double columnThreshold) {
      this.columnThreshold = columnThreshold;
    }

    public double getGroupThreshold() {
      return groupThreshold;
    }

    public void setGroupThreshold(double groupThreshold) {
      this.groupThreshold = groupThreshold;
    }

    public double getHeaderZoneRatio() {
      return headerZoneRatio;
    }

    public void setHeaderZoneRatio(double headerZoneRatio) {
      this.headerZoneRatio = headerZoneRatio;
    }

    public double getFooterZoneRatio() {
      return footerZoneRatio;
    }

    public void setFooterZoneRatio(double footerZoneRatio) {
      this.footerZoneRatio = footerZoneRatio;
    }

    public double getOverlapThreshold() {
      return overlapThreshold;
    }

    public void setOverlapThreshold(double overlapThreshold) {
      this.overlapThreshold = overlapThreshold;
    }

    public int getCoverMaxFragments() {
      return coverMaxFragments;
    }

    public void setCoverMaxFragments(int coverMaxFragments) {
      this.coverMaxFragments = coverMaxFragments;
    }

    public int getMinKeywordHits() {
      return minKeywordHits;
    }

    public void setMinKeywordHits(int minKeywordHits) {
      this.minKeywordHits = minKeywordHits;
    }

    public List<PageType> getPageTypeOrder() {
      return pageTypeOrder;
    }

    public void setPageTypeOrder(List<PageType> pageTypeOrder) {
      this.pageTypeOrder = pageTypeOrder != null ? new ArrayList<>(pageTypeOrder) : new ArrayList<>();
    }

    public Map<PageType, List<String>> getPageTypeKeywords() {
      return pageTypeKeywords;
    }

    public void setPageTypeKeywords(Map<PageType, List<String>> pageTypeKeywords) {
      this.pageTypeKeywords = new EnumMap<>(PageType.class);
      if (pageTypeKeywords != null) {
        this.pageTypeKeywords.putAll(pageTypeKeywords);
      }
    }

    public List<String> getContactKeywords() {
      return contactKeywords;
    }

    public void setContactKeywords(List<String> contactKeywords) {
      this.contactKeywords =
          contactKeywords != null ? new ArrayList<>(contactKeywords) : new ArrayList<>();
    }
  }

  public static class Cards {
    private double spanThreshold = 300.0d;
    private List<ObjectType> openingTypes =
        new ArrayList<>(
            List.of(
                ObjectType.PROMISE_NUMBER,
                ObjectType.PROMISE_TITLE,
                ObjectType.SECTION_TITLE,
                ObjectType.MAIN_TITLE));
    private Map<CardCategory, List<String>> categoryKeywords = defaultCategoryKeywords();

    private static Map<CardCategory, List<String>> defaultCategoryKeywords() {
      Map<CardCategory, List<String>> keywords = new LinkedHashMap<>();
      keywords.put(
          CardCategory.EDUCATION, List.of("교육", "학교", "학생", "도서관", "돌봄교실", "특구", "학습"));
      keywords.put(
          CardCategory.TRANSPORT,
          List.of("교통", "도로", "지하철", "버스", "주차", "경전철", "철도", "지하화"));
      keywords.put(
          CardCategory.WELFARE, List.of("복지", "어르신", "장애인", "의료", "건강", "돌봄", "경로당"));
      keywords.put(
          CardCategory.DEVELOPMENT,
          List.of("개발", "재개발", "재건축", "정비", "주거", "주택", "도시", "인프라"));
      keywords.put(
          CardCategory.CULTURE, List.of("문화", "체육", "공원", "축제", "예술", "관광", "녹지"));
      keywords.put(CardCategory.SAFETY, List.of("안전", "방범", "CCTV", "재난", "치안", "안심"));
      keywords.put(
          CardCategory.ECONOMY, List.of("경제", "일자리", "상권", "시장", "창업", "기업", "소상공인"));
      keywords.put(
          CardCategory.FAMILY, List.of("가족", "출산", "육아", "보육", "아이", "청년", "신혼"));
      return keywords;
    }

    public void validate() {
      requireNonNegative(spanThreshold, "cards.spanThreshold");
      if (openingTypes.isEmpty()) {
        throw new IllegalStateException("layout.engine.cards.openingTypes must not be empty");
      }
      if (categoryKeywords.isEmpty()) {
        throw new IllegalStateException("layout.engine.cards.categoryKeywords must not be empty");
      }
      if (categoryKeywords.containsKey(CardCategory.GENERAL)) {
        throw new IllegalStateException(
            "layout.engine.cards.categoryKeywords must not define keywords for GENERAL");
      }
      categoryKeywords.forEach(
          (category, keywords) ->
              requireKeywords(keywords, "cards.categoryKeywords." + category.name()));
    }

    public double getSpanThreshold() {
      return spanThreshold;
    }

    public void setSpanThreshold(double spanThreshold) {
      this.spanThreshold = spanThreshold;
    }

    public List<ObjectType> getOpeningTypes() {
      return openingTypes;
    }

    public void setOpeningTypes(List<ObjectType> openingTypes) {
      this.openingTypes = openingTypes != null ? new ArrayList<>(openingTypes) : new ArrayList<>();
    }

    public Map<CardCategory, List<String>> getCategoryKeywords() {
      return categoryKeywords;
    }

    public void setCategoryKeywords(Map<CardCategory, List<String>> categoryKeywords) {
      this.categoryKeywords =
          categoryKeywords != null ? new LinkedHashMap<>(categoryKeywords) : new LinkedHashMap<>();
    }
  }

  public static class Synthesis {
    private List<String> knownNames =
        new ArrayList<>(List.of("나경원", "이재명", "윤석열", "한동훈", "이준석", "조국"));
    private List<ObjectType> nameTypes = new ArrayList<>(List.of(ObjectType.CANDIDATE_NAME));
    private List<String> nameExclusions =
        new ArrayList<>(
            List.of(
                "후보", "후보자", "국회의원", "의원", "구청장", "시장", "위원장", "대표",
                "국민의힘", "민주당", "정의당", "무소속", "공약", "약속", "실적", "성과",
                "교육", "교통", "복지", "문화", "안전", "경제", "주거", "환경", "동작",
                "대한민국", "함께", "미래", "희망", "변화", "주민", "여러분", "감사합니다"));
    private String nameInitials =
        "김이박최정강조윤장임한오서신권황안송류전홍고문양손배백허유남심노하곽성차주우구나민진지엄채원천방공현함변염여추도소석선설마길연위표명기반왕금옥육인맹제모탁국어은편용";
    private List<String> organizationNames =
        new ArrayList<>(
            List.of(
                "국민의힘", "더불어민주당", "정의당", "개혁신당", "조국혁신당", "진보당",
                "새로운미래", "녹색당", "기본소득당", "무소속"));
    private List<String> pledgeExclusionKeywords =
        new ArrayList<>(
            List.of(
                "학력", "경력", "약력", "졸업", "前", "現", "출생", "연락처", "사무소", "후원",
                "선거", "기호", "투표", "페이지"));
    private List<String> highlightKeywords =
        new ArrayList<>(
            List.of("특구", "신설", "유치", "확충", "개통", "조성", "착공", "지하화", "무료", "건립"));
    private int maxHighlights = 6;
    private int minPledgeTitleLength = 5;
    private int sloganMinLength = 5;
    private int sloganMaxLength = 50;
    private String districtPattern =
        "([가-힣]{1,3}[0-9]{0,2}(?<![활운행공협이자감노출변작])동)(?=$|[\\s,·:)])";

    public void validate() {
      requireKeywords(knownNames, "synthesis.knownNames");
      if (nameTypes.isEmpty()) {
        throw new IllegalStateException("layout.engine.synthesis.nameTypes must not be empty");
      }
      requireKeywords(nameExclusions, "synthesis.nameExclusions");
      if (!StringUtils.hasText(nameInitials)) {
        throw new IllegalStateException("layout.engine.synthesis.nameInitials must not be blank");
      }
      requireKeywords(organizationNames, "synthesis.organizationNames");
      requireKeywords(pledgeExclusionKeywords, "synthesis.pledgeExclusionKeywords");
      requireKeywords(highlightKeywords, "synthesis.highlightKeywords");
      if (maxHighlights < 1) {
        throw new IllegalStateException(
            "layout.engine.synthesis.maxHighlights must be at least 1 but was " + maxHighlights);
      }
      requireNonNegative(minPledgeTitleLength, "synthesis.minPledgeTitleLength");
      requireNonNegative(sloganMinLength, "synthesis.sloganMinLength");
      if (sloganMinLength > sloganMaxLength) {
        throw new IllegalStateException(
            "layout.engine.synthesis.sloganMinLength (%d) must not exceed sloganMaxLength (%d)"
                .formatted(sloganMinLength, sloganMaxLength));
      }
      compileDistrictPattern();
    }

    public Pattern compileDistrictPattern() {
      if (!StringUtils.hasText(districtPattern)) {
        throw new IllegalStateException("layout.engine.synthesis.districtPattern must not be blank");
      }
      try {
        return Pattern.compile(districtPattern);
      } catch (PatternSyntaxException ex) {
        throw new IllegalStateException(
            "layout.engine.synthesis.districtPattern is not a valid regular expression", ex);
      }
    }

    public List<String> getKnownNames() {
      return knownNames;
    }

    public void setKnownNames(List<String> knownNames) {
      this.knownNames = knownNames != null ? new ArrayList<>(knownNames) : new ArrayList<>();
    }

    public List<ObjectType> getNameTypes() {
      return nameTypes;
    }

    public void setNameTypes(List<ObjectType> nameTypes) {
      this.nameTypes = nameTypes != null ? new ArrayList<>(nameTypes) : new ArrayList<>();
    }

    public List<String> getNameExclusions() {
      return nameExclusions;
    }

    public void setNameExclusions(List<String> nameExclusions) {
      this.nameExclusions =
          nameExclusions != null ? new ArrayList<>(nameExclusions) : new ArrayList<>();
    }

    public String getNameInitials() {
      return nameInitials;
    }

    public void setNameInitials(String nameInitials) {
      this.nameInitials = nameInitials;
    }

    public List<String> getOrganizationNames() {
      return organizationNames;
    }

    public void setOrganizationNames(List<String> organizationNames) {
      this.organizationNames =
          organizationNames != null ? new ArrayList<>(organizationNames) : new ArrayList<>();
    }

    public List<String> getPledgeExclusionKeywords() {
      return pledgeExclusionKeywords;
    }

    public void setPledgeExclusionKeywords(List<String> pledgeExclusionKeywords) {
      this.pledgeExclusionKeywords =
          pledgeExclusionKeywords != null ? new ArrayList<>(pledgeExclusionKeywords) : new ArrayList<>();
    }

    public List<String> getHighlightKeywords() {
      return highlightKeywords;
    }

    public void setHighlightKeywords(List<String> highlightKeywords) {
      this.highlightKeywords =
          highlightKeywords != null ? new ArrayList<>(highlightKeywords) : new ArrayList<>();
    }

    public int getMaxHighlights() {
      return maxHighlights;
    }

    public void setMaxHighlights(int maxHighlights) {
      this.maxHighlights = maxHighlights;
    }

    public int getMinPledgeTitleLength() {
      return minPledgeTitleLength;
    }

    public void setMinPledgeTitleLength(int minPledgeTitleLength) {
      this.minPledgeTitleLength = minPledgeTitleLength;
    }

    public int getSloganMinLength() {
      return sloganMinLength;
    }

    public void setSloganMinLength(int sloganMinLength) {
      this.sloganMinLength = sloganMinLength;
    }

    public int getSloganMaxLength() {
      return sloganMaxLength;
    }

    public void setSloganMaxLength(int sloganMaxLength) {
      this.sloganMaxLength = sloganMaxLength;
    }

    public String getDistrictPattern() {
      return districtPattern;
    }

    public void setDistrictPattern(String districtPattern) {
      this.districtPattern = districtPattern;
    }
  }

  private static void requireNonNegative(double value, String property) {
    if (value < 0) {
      throw new IllegalStateException(
          "layout.engine.%s must not be negative but was %s".formatted(property, value));
    }
  }

  private static void requireRatio(double value, String property) {
    if (value < 0 || value > MAX_ZONE_RATIO) {
      throw new IllegalStateException(
          "layout.engine.%s must be between 0 and %.1f but was %s"
              .formatted(property, MAX_ZONE_RATIO, value));
    }
  }

  private static void requireKeywords(Collection<String> keywords, String property) {
    if (keywords == null || keywords.isEmpty()) {
      throw new IllegalStateException("layout.engine.%s must not be empty".formatted(property));
    }
    for (String keyword : keywords) {
      if (!StringUtils.hasText(keyword)) {
        throw new IllegalStateException(
            "layout.engine.%s must not contain blank entries".formatted(property));
      }
    }
  }
}
