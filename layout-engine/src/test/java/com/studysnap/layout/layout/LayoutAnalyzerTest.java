package com.studysnap.layout.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.studysnap.layout.config.LayoutEngineProperties;
import com.studysnap.layout.model.BoundingBox;
import com.studysnap.layout.model.ClassifiedObject;
import com.studysnap.layout.model.FontStyle;
import com.studysnap.layout.model.ObjectType;
import com.studysnap.layout.model.TextStyle;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LayoutAnalyzerTest {

  private final LayoutAnalyzer analyzer = new LayoutAnalyzer(new LayoutEngineProperties.Layout());

  @Test
  void emptyInputYieldsEmptyLayout() {
    assertThat(analyzer.analyzeLayout(List.of())).isSameAs(DocumentLayout.EMPTY);
    assertThat(analyzer.analyzeLayout(null).documentStructure().pageCount()).isZero();

    PageLayout page = analyzer.analyzePage(3, List.of());
    assertThat(page.columnCount()).isEqualTo(1);
    assertThat(page.groups()).isEmpty();
    assertThat(page.readingOrder()).isEmpty();
  }

  @Test
  void singleObjectFormsSingleGroup() {
    ClassifiedObject only = object("a", ObjectType.PARAGRAPH, "본문", 50, 200, 1);

    PageLayout page = analyzer.analyzePage(1, List.of(only));

    assertThat(page.groups()).hasSize(1);
    assertThat(page.groups().get(0).groupId()).isEqualTo("p1-g0");
    assertThat(page.groups().get(0).layoutHint()).isEqualTo("stack");
    assertThat(page.readingOrder()).extracting(ClassifiedObject::id).containsExactly("a");
    assertThat(page.zones().body()).hasSize(1);
  }

  @Test
  void groupsArePartitionOfPageObjects() {
    List<ClassifiedObject> objects =
        List.of(
            object("a", ObjectType.PARAGRAPH, "가", 50, 100, 1),
            object("b", ObjectType.PARAGRAPH, "나", 50, 120, 1),
            object("c", ObjectType.PARAGRAPH, "다", 300, 110, 1),
            object("d", ObjectType.PARAGRAPH, "라", 50, 160, 1),
            object("e", ObjectType.PARAGRAPH, "마", 300, 400, 1));

    PageLayout page = analyzer.analyzePage(1, objects);

    List<String> grouped = new ArrayList<>();
    page.groups().forEach(group -> group.members().forEach(member -> grouped.add(member.id())));
    assertThat(grouped).containsExactlyInAnyOrder("a", "b", "c", "d", "e");
    assertThat(page.groups())
        .extracting(ObjectGroup::size)
        .containsExactly(3, 1, 1);
    assertThat(page.groups().get(1).members().get(0).groupId()).isEqualTo("p1-g1");
  }

  @Test
  void objectsWithinColumnThresholdShareColumn() {
    List<ClassifiedObject> objects =
        List.of(
            object("a", ObjectType.PARAGRAPH, "가", 50, 100, 1),
            object("b", ObjectType.PARAGRAPH, "나", 100, 200, 1),
            object("c", ObjectType.PARAGRAPH, "다", 145, 300, 1),
            object("d", ObjectType.PARAGRAPH, "라", 300, 400, 1));

    assertThat(analyzer.detectColumns(objects)).containsExactly(50.0, 300.0);
  }

  @Test
  void readsColumnsLeftToRight() {
    List<ClassifiedObject> objects =
        List.of(
            object("right-top", ObjectType.PARAGRAPH, "가", 320, 50, 1),
            object("left-top", ObjectType.PARAGRAPH, "나", 40, 100, 1),
            object("right-bottom", ObjectType.PARAGRAPH, "다", 310, 150, 1),
            object("left-bottom", ObjectType.PARAGRAPH, "라", 60, 200, 1));

    PageLayout page = analyzer.analyzePage(1, objects);

    assertThat(page.columnCount()).isEqualTo(2);
    assertThat(page.readingOrder())
        .extracting(ClassifiedObject::id)
        .containsExactly("left-top", "left-bottom", "right-top", "right-bottom");
  }

  @Test
  void splitsPageIntoZonesByRelativeHeight() {
    List<ClassifiedObject> objects =
        List.of(
            object("top", ObjectType.HEADER, "머리", 50, 0, 1),
            object("upper", ObjectType.PARAGRAPH, "위", 50, 300, 1),
            object("middle", ObjectType.PARAGRAPH, "가운데", 50, 500, 1),
            object("bottom", ObjectType.FOOTER, "꼬리", 50, 1000, 1));

    ContentZones zones = analyzer.analyzePage(1, objects).zones();

    assertThat(zones.header()).extracting(ClassifiedObject::id).containsExactly("top");
    assertThat(zones.body()).extracting(ClassifiedObject::id).containsExactly("upper", "middle");
    assertThat(zones.footer()).extracting(ClassifiedObject::id).containsExactly("bottom");
  }

  @Test
  void derivesGroupHintsAndOverlap() {
    ClassifiedObject name = object("name", ObjectType.CANDIDATE_NAME, "나경원", 50, 100, 1);
    ClassifiedObject bulletOne = object("b1", ObjectType.BULLET_LIST, "· 하나", 50, 300, 1);
    ClassifiedObject bulletTwo = object("b2", ObjectType.BULLET_LIST, "· 둘", 50, 320, 1);
    ClassifiedObject left = object("l", ObjectType.PARAGRAPH, "왼쪽", 50, 500, 1);
    ClassifiedObject right = object("r", ObjectType.PARAGRAPH, "오른쪽", 300, 505, 1);
    ClassifiedObject title =
        new ClassifiedObject(
            "t",
            ObjectType.SECTION_TITLE,
            0.9,
            "교육",
            TextStyle.of(20, FontStyle.BOLD),
            new BoundingBox(50, 700, 100, 10, 1),
            null,
            null);
    ClassifiedObject body = object("tb", ObjectType.PARAGRAPH, "본문", 55, 702, 1);

    List<ObjectGroup> groups =
        analyzer
            .analyzePage(1, List.of(name, bulletOne, bulletTwo, left, right, title, body))
            .groups();

    assertThat(groups)
        .extracting(ObjectGroup::layoutHint)
        .containsExactly("hero", "list", "grid", "accordion");
    assertThat(groups.get(3).overlapping()).isTrue();
    assertThat(groups.get(1).overlapping()).isFalse();
    assertThat(groups.get(2).bounds()).isEqualTo(new BoundingBox(50, 500, 350, 15, 1));
  }

  @Test
  void infersPageTypesAndKeepsInputOrder() {
    List<ClassifiedObject> objects =
        List.of(
            object("cover", ObjectType.CANDIDATE_NAME, "나경원", 50, 100, 1),
            object("profile-1", ObjectType.PROFILE_TITLE, "학력", 50, 100, 2),
            object("profile-2", ObjectType.CAREER, "前 국회의원 경력", 50, 140, 2),
            object("pledge", ObjectType.PROMISE_NUMBER, "1)교통 개선", 50, 100, 3),
            object("plain", ObjectType.PARAGRAPH, "안녕하세요", 50, 100, 4),
            object("contact", ObjectType.CONTACT, "연락처 02-812-1234", 50, 100, 5));

    DocumentLayout layout = analyzer.analyzeLayout(objects);

    DocumentStructure structure = layout.documentStructure();
    assertThat(structure.pageCount()).isEqualTo(5);
    assertThat(structure.totalObjects()).isEqualTo(6);
    assertThat(structure.pageType(1)).isEqualTo(PageType.COVER);
    assertThat(structure.pageType(2)).isEqualTo(PageType.PROFILE);
    assertThat(structure.pageType(3)).isEqualTo(PageType.PLEDGE);
    assertThat(structure.pageType(4)).isEqualTo(PageType.CONTENT);
    assertThat(structure.pageType(5)).isEqualTo(PageType.CONTACT);
    assertThat(layout.objects())
        .extracting(ClassifiedObject::id)
        .containsExactly("cover", "profile-1", "profile-2", "pledge", "plain", "contact");
    assertThat(layout.objects()).allSatisfy(object -> assertThat(object.groupId()).isNotNull());
    assertThat(layout.readingOrder()).hasSize(6);
  }

  @Test
  void rejectsNegativeThresholds() {
    LayoutEngineProperties.Layout properties = new LayoutEngineProperties.Layout();
    properties.setGroupThreshold(-1);

    assertThatThrownBy(() -> new LayoutAnalyzer(properties))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("groupThreshold");
  }

  private static ClassifiedObject object(
      String id, ObjectType type, String content, double x, double y, int page) {
    return new ClassifiedObject(
        id,
        type,
        0.9,
        content,
        TextStyle.of(12, FontStyle.REGULAR),
        new BoundingBox(x, y, 100, 10, page),
        null,
        null);
  }
}
