package com.studysnap.layout.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.studysnap.layout.cards.CardCategory;
import com.studysnap.layout.mobile.ContactEntry;
import com.studysnap.layout.mobile.Hero;
import com.studysnap.layout.mobile.MobileLayout;
import com.studysnap.layout.mobile.PledgeCard;
import com.studysnap.layout.model.FontStyle;
import com.studysnap.layout.model.ObjectType;
import com.studysnap.layout.model.TextAlignment;
import com.studysnap.layout.model.TextFragment;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FragmentJsonCodecTest {

  private final FragmentJsonCodec codec = new FragmentJsonCodec();

  @Test
  void readsFragmentsWithDefaults() {
    String json =
        """
        [
          {"text": "나경원", "style": {"font_size": 30, "font_style": "BOLD", "alignment": "center"},
           "bbox": {"x": 10, "y": 20, "width": 100, "height": 30}},
          {"id": "f-2", "text": "본문", "style": {"font_style": "oblique", "alignment": "diagonal"}},
          {"text": "스타일 없음", "extra": true}
        ]
        """;

    List<TextFragment> fragments = codec.readFragments(json);

    assertThat(fragments).hasSize(3);
    TextFragment first = fragments.get(0);
    assertThat(first.style().fontSize()).isEqualTo(30.0);
    assertThat(first.style().fontStyle()).isEqualTo(FontStyle.BOLD);
    assertThat(first.style().alignment()).isEqualTo(TextAlignment.CENTER);
    assertThat(first.style().color()).isEqualTo("#000000");
    assertThat(first.boundingBox().page()).isEqualTo(1);
    assertThat(first.boundingBox().y()).isEqualTo(20.0);

    TextFragment second = fragments.get(1);
    assertThat(second.id()).isEqualTo("f-2");
    assertThat(second.style().fontSize()).isEqualTo(12.0);
    assertThat(second.style().fontStyle()).isEqualTo(FontStyle.REGULAR);
    assertThat(second.style().alignment()).isEqualTo(TextAlignment.LEFT);
    assertThat(second.boundingBox()).isNull();

    assertThat(fragments.get(2).style()).isNull();
  }

  @Test
  void rejectsMalformedJson() {
    assertThatThrownBy(() -> codec.readFragments("[{\"text\": "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Malformed fragment JSON");
    assertThatThrownBy(() -> codec.readFragments(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void writesLayoutInSnakeCase() {
    MobileLayout layout =
        new MobileLayout(
            new Hero("나경원", null, "국민의힘"),
            List.of(),
            List.of(new PledgeCard(1, "교육특구 지정", CardCategory.EDUCATION, List.of("돌봄"), true)),
            List.of(),
            List.of(),
            List.of(new ContactEntry(ObjectType.CONTACT, "02-812-1234")),
            Map.of("상도1동", List.of("상도1동 주민센터 건립")));

    String json = codec.writeLayout(layout);

    assertThat(json)
        .contains("\"quick_highlights\":[]")
        .contains("\"pledge_cards\":[")
        .contains("\"district_pledges\":{\"상도1동\"")
        .contains("\"candidate\":\"나경원\"")
        .contains("\"category\":\"EDUCATION\"")
        .doesNotContain("slogan");
  }
}
