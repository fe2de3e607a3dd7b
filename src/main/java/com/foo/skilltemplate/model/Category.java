package com.foo.skilltemplate.model;

import java.util.List;

/** 화면 표시용 카테고리. 파생될 때마다 새로 만들어지며 직접 수정하지 않는다. */
public record Category(String name, List<SkillRecord> skills) {

  public Category {
    skills = List.copyOf(skills);
  }

  public int size() {
    return skills.size();
  }
}
