package com.studysnap.layout.model;

/**
 * Closed taxonomy of semantic types a fragment can be classified as.
 *
 * <p>Each type has a short code used in serialized output and belongs to exactly one {@link
 * Family}.
 */
public enum ObjectType {
  MAIN_TITLE("H1", Family.TEXT),
  SECTION_TITLE("H2", Family.TEXT),
  SUB_TITLE("H3", Family.TEXT),
  PARAGRAPH("P", Family.TEXT),
  QUOTE("QT", Family.TEXT),
  CAPTION("CAP", Family.TEXT),

  BULLET_LIST("BL", Family.LIST),
  NUMBERED_LIST("NL", Family.LIST),

  CARD("CARD", Family.STRUCTURE),
  TIMELINE("TL", Family.STRUCTURE),
  TABLE("TB", Family.STRUCTURE),
  BOX("BOX", Family.STRUCTURE),

  IMAGE("IMG", Family.VISUAL),
  PHOTO("PHOTO", Family.VISUAL),
  CHART("CHART", Family.VISUAL),
  LOGO("LOGO", Family.VISUAL),
  ICON("ICON", Family.VISUAL),
  SIGNATURE("SIG", Family.VISUAL),

  HEADER("HDR", Family.META),
  FOOTER("FTR", Family.META),
  PAGE_NUMBER("PAGE_NUM", Family.META),
  CONTACT("CONTACT", Family.META),
  SNS("SNS", Family.META),

  CANDIDATE_NAME("CAND", Family.DOMAIN),
  PARTY_INFO("PARTY", Family.DOMAIN),
  SLOGAN("SLOGAN", Family.DOMAIN),
  PLEDGE("PLEDGE", Family.DOMAIN),
  ACHIEVEMENT("ACHV", Family.DOMAIN),
  CAREER("CAREER", Family.DOMAIN),
  PROMISE_NUMBER("PNUM", Family.DOMAIN),
  PROMISE_TITLE("PTITLE", Family.DOMAIN),
  DISTRICT_INFO("DIST", Family.DOMAIN),
  PLEDGE_SECTION_TITLE("PSEC", Family.DOMAIN),
  ACHIEVEMENT_TITLE("ASEC", Family.DOMAIN),
  PROFILE_TITLE("PROF", Family.DOMAIN);

  private final String code;
  private final Family family;

  ObjectType(String code, Family family) {
    this.code = code;
    this.family = family;
  }

  public String code() {
    return code;
  }

  public Family family() {
    return family;
  }

  public enum Family {
    TEXT,
    LIST,
    STRUCTURE,
    VISUAL,
    META,
    DOMAIN
  }
}
