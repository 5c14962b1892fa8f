package com.studysnap.layout.classification;

import static com.studysnap.layout.classification.ClassificationRule.builder;

import com.studysnap.layout.model.FontStyle;
import com.studysnap.layout.model.ObjectType;
import java.util.List;

/**
 * Built-in rule table for Korean election leaflets.
 *
 * <p>Rules driven only by style, colour, position or text length stay candidates for almost any
 * fragment, so they share the catch-all's priority ({@link #SOFT_TIER}) and compete on confidence
 * alone. The content rules keep the priorities tuned against real leaflets, except that party
 * names outrank the generic candidate-name shape.
 */
final class DefaultRules {

  static final int SOFT_TIER = 1;

  private static final String HANGUL_NAME =
      "^(?!(교육|교통|복지|주거|문화|안전|경제|환경|보육|청년|가족|공약|약속|실적|성과|학력|경력|약력|함께|미래|희망|변화)$)"
          + "[가-힣]{2,4}$";

  private DefaultRules() {}

  static List<ClassificationRule> rules() {
    return List.of(
        builder("party_info", ObjectType.PARTY_INFO, 101)
            .contentPattern("(국민의힘|더불어민주당|정의당|녹색당|기본소득당|개혁신당|진보당|조국혁신당|새로운미래|무소속)")
            .baseConfidence(0.99)
            .build(),
        builder("candidate_name", ObjectType.CANDIDATE_NAME, 100)
            .minFontSize(20.0)
            .contentPattern(HANGUL_NAME)
            .position(PositionRule.TOP)
            .baseConfidence(0.90)
            .build(),
        builder("pledge_number", ObjectType.PROMISE_NUMBER, 98)
            .contentPattern("^(공약|약속)?\\s*[0-9]+\\s*$|^제?\\s*[0-9]+\\s*(호|번)?\\s*공약")
            .baseConfidence(0.95)
            .build(),
        builder("bullet_list", ObjectType.BULLET_LIST, 95)
            .contentPattern("^\\s*[·•\\-▶▷◆◇★☆✓✔→►]")
            .baseConfidence(0.98)
            .build(),
        builder("numbered_list", ObjectType.NUMBERED_LIST, 95)
            .contentPattern("^\\s*(\\d+[.)]\\s|[①②③④⑤⑥⑦⑧⑨⑩])")
            .baseConfidence(0.98)
            .build(),
        builder("contact_phone", ObjectType.CONTACT, 95)
            .contentPattern("(전화|TEL|☎)?\\s*0\\d{1,2}[-.\\s]?\\d{3,4}[-.\\s]?\\d{4}")
            .baseConfidence(0.98)
            .build(),
        builder("contact_email", ObjectType.CONTACT, 95)
            .contentPattern("[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}")
            .baseConfidence(0.99)
            .build(),
        builder("sns_link", ObjectType.SNS, 95)
            .contentPattern("(facebook|instagram|twitter|youtube|blog|naver|kakao|@)")
            .baseConfidence(0.95)
            .build(),
        builder("achievement_title", ObjectType.ACHIEVEMENT_TITLE, 94)
            .contentPattern("이\\s*바꾼|주요\\s*(실적|성과)|의정\\s*활동")
            .baseConfidence(0.90)
            .build(),
        builder("promise_card_number", ObjectType.PROMISE_NUMBER, 94)
            .contentPattern("^\\d{1,2}[.)]\\s*[가-힣]")
            .baseConfidence(0.90)
            .build(),
        builder("pledge_section_title", ObjectType.PLEDGE_SECTION_TITLE, 93)
            .contentPattern("^(핵심|대표|주요|동별|분야별)\\s*공약")
            .baseConfidence(0.90)
            .build(),
        builder("profile_title", ObjectType.PROFILE_TITLE, 93)
            .contentPattern("^(학력|경력|약력|프로필|주요\\s*경력)$")
            .baseConfidence(0.90)
            .build(),
        builder("timeline_year", ObjectType.TIMELINE, 92)
            .contentPattern("^(19|20)\\d{2}[\\s.\\-년]")
            .baseConfidence(0.95)
            .build(),
        builder("promise_title", ObjectType.PROMISE_TITLE, 91)
            .contentPattern("^\\[?(교육|교통|복지|주거|문화|안전|경제|일자리|환경|보육|청년|가족)\\]?\\s*(분야|공약)?$")
            .baseConfidence(0.92)
            .build(),
        builder("page_number", ObjectType.PAGE_NUMBER, 90)
            .contentPattern("^\\s*-?\\s*\\d{1,3}\\s*-?\\s*$")
            .position(PositionRule.BOTTOM)
            .baseConfidence(0.90)
            .build(),
        builder("district_info", ObjectType.DISTRICT_INFO, 89)
            .contentPattern("[가-힣]{1,3}[0-9]{0,2}(?<![활운행공협이자감노출변작])동(?=$|[\\s,·:)])")
            .baseConfidence(0.85)
            .build(),
        builder("slogan", ObjectType.SLOGAN, 88)
            .minFontSize(16.0)
            .contentPattern("[!！]$|함께|약속|미래|변화|희망")
            .baseConfidence(0.85)
            .build(),
        builder("quote", ObjectType.QUOTE, 88)
            .contentPattern("^[\"'“‘].*[\"'”’]$|^「.*」$|^『.*』$")
            .baseConfidence(0.92)
            .build(),
        builder("career", ObjectType.CAREER, 87)
            .contentPattern("^\\(?(前|現|전|현)\\)?\\s|^(前|現)")
            .baseConfidence(0.88)
            .build(),
        builder("achievement", ObjectType.ACHIEVEMENT, 85)
            .contentPattern("(실적|성과|완료|달성|유치|확보|신설|개통|증가|감소|\\d+%|\\d+억|\\d+만)")
            .baseConfidence(0.80)
            .build(),
        builder("caption", ObjectType.CAPTION, 75)
            .contentPattern("^(사진|그림|표|출처)\\s*[:.\\d]|^※")
            .baseConfidence(0.80)
            .build(),
        builder("main_title_large", ObjectType.MAIN_TITLE, SOFT_TIER)
            .minFontSize(24.0)
            .fontStyle(FontStyle.BOLD)
            .position(PositionRule.TOP)
            .baseConfidence(0.95)
            .build(),
        builder("main_title_center", ObjectType.MAIN_TITLE, SOFT_TIER)
            .minFontSize(18.0)
            .contentPattern("^.{2,20}$")
            .position(PositionRule.CENTER)
            .baseConfidence(0.85)
            .build(),
        builder("section_title_blue", ObjectType.SECTION_TITLE, SOFT_TIER)
            .colorPattern("#(2563EB|1E40AF|3B82F6|0066CC|0000FF|004EA2)")
            .fontStyle(FontStyle.BOLD)
            .baseConfidence(0.95)
            .build(),
        builder("section_title_red", ObjectType.SECTION_TITLE, SOFT_TIER)
            .colorPattern("#(DC2626|EF4444|B91C1C|FF0000|CC0000|E11D48)")
            .fontStyle(FontStyle.BOLD)
            .baseConfidence(0.95)
            .build(),
        builder("section_title_size", ObjectType.SECTION_TITLE, SOFT_TIER)
            .minFontSize(14.0)
            .maxFontSize(24.0)
            .fontStyle(FontStyle.BOLD)
            .baseConfidence(0.80)
            .build(),
        builder("sub_title_grey", ObjectType.SUB_TITLE, SOFT_TIER)
            .maxFontSize(14.0)
            .colorPattern("#(6B7280|666666|777777|888888|999999|4B5563|9CA3AF)")
            .baseConfidence(0.75)
            .build(),
        builder("header", ObjectType.HEADER, SOFT_TIER)
            .maxFontSize(10.0)
            .position(PositionRule.TOP)
            .baseConfidence(0.75)
            .build(),
        builder("footer", ObjectType.FOOTER, SOFT_TIER)
            .maxFontSize(10.0)
            .position(PositionRule.BOTTOM)
            .baseConfidence(0.75)
            .build(),
        builder("paragraph_default", ObjectType.PARAGRAPH, SOFT_TIER).baseConfidence(0.50).build());
  }
}
