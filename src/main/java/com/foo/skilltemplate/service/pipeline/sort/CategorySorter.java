package com.foo.skilltemplate.service.pipeline.sort;

import com.foo.skilltemplate.model.Category;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * 카테고리 이름 앞의 번호("2. Strategic Skills" → 2) 순으로 정렬한다.
 *
 * <p>번호가 없는 카테고리는 번호 있는 카테고리 뒤에 온다. 같은 순위끼리는 입력 순서를 유지한다.
 */
@Component
public class CategorySorter {

  private static final Pattern LEADING_NUMBER = Pattern.compile("^\\d+");

  private static final Comparator<BigInteger> PREFIX_ORDER =
      Comparator.nullsLast(Comparator.naturalOrder());

  public List<Category> sort(List<Category> categories) {
    List<Category> sorted = new ArrayList<>(categories);
    // List.sort는 안정 정렬
    sorted.sort(
        Comparator.<Category, BigInteger>comparing(c -> leadingNumber(c.name()), PREFIX_ORDER));
    return sorted;
  }

  /** 이름 앞의 정수. 없으면 null. */
  static BigInteger leadingNumber(String name) {
    if (name == null) {
      return null;
    }
    Matcher matcher = LEADING_NUMBER.matcher(name);
    return matcher.find() ? new BigInteger(matcher.group()) : null;
  }
}
