package com.studysnap.layout.mobile;

import static org.assertj.core.api.Assertions.assertThat;

import com.studysnap.layout.cards.Card;
import com.studysnap.layout.cards.CardCategory;
import com.studysnap.layout.config.LayoutEngineProperties;
import com.studysnap.layout.model.BoundingBox;
import com.studysnap.layout.model.ClassifiedObject;
import com.studysnap.layout.model.ObjectType;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MobileLayoutSynthesizerTest {

  private final MobileLayoutSynthesizer synthesizer =
      new MobileLayoutSynthesizer(new LayoutEngineProperties.Synthesis());

  @Test
  void knownNameWinsOverEarlierPatternMatch() {
    List<ClassifiedObject> objects =
        List.of(
            object(ObjectType.CANDIDATE_NAME, "김철수"),
            object(ObjectType.PARAGRAPH, "안녕하세요"),
            object(ObjectType.PARAGRAPH, "이재명"));

    MobileLayout layout = synthesizer.synthesize(objects, List.of());

    assertThat(layout.hero().candidate()).isEqualTo("이재명");
  }

  @Test
  void fallsBackToNameShapedFragment() {
    assertThat(synthesizer.findCandidate(List.of(object(ObjectType.CANDIDATE_NAME, "김철수"))))
        .isEqualTo("김철수");
    assertThat(synthesizer.findCandidate(List.of(object(ObjectType.PARAGRAPH, "김철수")))).isNull();
    assertThat(synthesizer.findCandidate(List.of(object(ObjectType.CANDIDATE_NAME, "함께"))))
        .isNull();
    assertThat(synthesizer.findCandidate(List.of(object(ObjectType.CANDIDATE_NAME, "깡통"))))
        .isNull();
    assertThat(synthesizer.findCandidate(List.of(object(ObjectType.CANDIDATE_NAME, "김 철수"))))
        .isNull();
  }

  @Test
  void picksSloganAndParty() {
    List<ClassifiedObject> objects =
        List.of(
            object(ObjectType.SLOGAN, "미래!"),
            object(ObjectType.SLOGAN, "다시 뛰는 동작"),
            object(ObjectType.SLOGAN, "함께 갑시다!"),
            object(ObjectType.PARAGRAPH, "기호 2번 국민의힘 후보"));

    Hero hero = synthesizer.synthesize(objects, List.of()).hero();

    assertThat(hero.slogan()).isEqualTo("함께 갑시다!");
    assertThat(hero.party()).isEqualTo("국민의힘");
    assertThat(hero.candidate()).isNull();
  }

  @Test
  void filtersAndDeduplicatesPledgeCards() {
    List<Card> cards =
        List.of(
            card(1, "교육특구 지정 추진", CardCategory.EDUCATION, "초등 돌봄 확대", "도서관 확충"),
            card(2, "학력 및 경력 소개", CardCategory.EDUCATION),
            card(3, "교통", CardCategory.TRANSPORT),
            card(4, "새로운 동작을 위하여", CardCategory.GENERAL),
            card(5, "마을버스 노선 개선", CardCategory.TRANSPORT),
            card(6, "교육특구 지정 추진", CardCategory.EDUCATION, "중복"));

    List<PledgeCard> pledges = synthesizer.synthesize(List.of(), cards).pledgeCards();

    assertThat(pledges).extracting(PledgeCard::title)
        .containsExactly("교육특구 지정 추진", "마을버스 노선 개선");
    assertThat(pledges).extracting(PledgeCard::number).containsExactly(1, 2);
    assertThat(pledges.get(0).details()).containsExactly("초등 돌봄 확대", "도서관 확충");
    assertThat(pledges.get(0).highlighted()).isTrue();
    assertThat(pledges.get(1).highlighted()).isFalse();
  }

  @Test
  void quickHighlightsPutHighlightedFirstAndCapAtSix() {
    List<Card> cards = new ArrayList<>();
    for (int i = 1; i <= 5; i++) {
      cards.add(card(i, "버스 노선 개선 " + i, CardCategory.TRANSPORT));
    }
    cards.add(card(6, "경전철 착공 추진", CardCategory.TRANSPORT));
    cards.add(card(7, "체육센터 건립 추진", CardCategory.CULTURE));
    cards.add(card(8, "버스 노선 개선 8", CardCategory.TRANSPORT));

    MobileLayout layout = synthesizer.synthesize(List.of(), cards);

    assertThat(layout.pledgeCards()).hasSize(8);
    assertThat(layout.quickHighlights()).hasSize(6);
    assertThat(layout.quickHighlights())
        .extracting(PledgeCard::title)
        .containsExactly(
            "경전철 착공 추진",
            "체육센터 건립 추진",
            "버스 노선 개선 1",
            "버스 노선 개선 2",
            "버스 노선 개선 3",
            "버스 노선 개선 4");
  }

  @Test
  void collectsTimelineAchievementsContactsAndDistricts() {
    List<ClassifiedObject> objects =
        List.of(
            object(ObjectType.TIMELINE, "2018 동작구 구의원 당선"),
            object(ObjectType.TIMELINE, "구청 정책자문위원"),
            object(ObjectType.ACHIEVEMENT, "사당역 환승센터 유치"),
            object(ObjectType.CONTACT, "02-812-1234"),
            object(ObjectType.SNS, "instagram.com/candidate"),
            object(ObjectType.DISTRICT_INFO, "상도1동 주민센터 건립"),
            object(ObjectType.DISTRICT_INFO, "흑석동 공원 조성"),
            object(ObjectType.DISTRICT_INFO, "상도1동 도서관 확충"),
            object(ObjectType.PARAGRAPH, "상도1동 이야기"));

    MobileLayout layout = synthesizer.synthesize(objects, List.of());

    assertThat(layout.timelineItems())
        .containsExactly(
            new TimelineItem("2018", "동작구 구의원 당선"), new TimelineItem(null, "구청 정책자문위원"));
    assertThat(layout.achievements()).containsExactly("사당역 환승센터 유치");
    assertThat(layout.contactSection())
        .containsExactly(
            new ContactEntry(ObjectType.CONTACT, "02-812-1234"),
            new ContactEntry(ObjectType.SNS, "instagram.com/candidate"));
    assertThat(layout.districtPledges()).containsOnlyKeys("상도1동", "흑석동");
    assertThat(layout.districtPledges().get("상도1동"))
        .containsExactly("상도1동 주민센터 건립", "상도1동 도서관 확충");
  }

  @Test
  void emptyInputYieldsEmptyLayout() {
    assertThat(synthesizer.synthesize(List.of(), List.of())).isSameAs(MobileLayout.EMPTY);
    assertThat(synthesizer.synthesize(null, null).hero()).isEqualTo(Hero.EMPTY);
  }

  private static ClassifiedObject object(ObjectType type, String content) {
    return new ClassifiedObject(
        "obj", type, 0.9, content, null, new BoundingBox(50, 100, 100, 10, 1), null, null);
  }

  private static Card card(int number, String title, CardCategory category, String... details) {
    List<ClassifiedObject> content = new ArrayList<>();
    for (String detail : details) {
      content.add(object(ObjectType.PARAGRAPH, detail));
    }
    return new Card(
        "card_" + number, object(ObjectType.PROMISE_NUMBER, title), content, category);
  }
}
