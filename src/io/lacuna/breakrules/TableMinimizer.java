package io.lacuna.breakrules;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shrinks a forward state table and its character categories together, until neither has anything left to merge.
 *
 * Two categories whose columns are identical in every state can't be told apart by the table, so one is folded into
 * the other. Removing a column can make two states identical, and merging states can make two more columns
 * identical, so both steps repeat until a full round changes nothing.
 */
public class TableMinimizer {

  private static final Logger LOGGER = Logger.getLogger(TableMinimizer.class.getName());

  /**
   * The side of the category mapping that the minimizer updates.
   */
  public interface CategoryMerger {

    int categoryCount();

    /**
     * Folds {@code remove} into {@code keep}, where {@code keep < remove}, and renumbers the categories above
     * {@code remove} down by one.
     */
    void mergeCategories(int keep, int remove);
  }

  public static class Result {
    public final int rounds;
    public final int categoriesBefore, categoriesAfter;
    public final int statesBefore, statesAfter;
    public final int categoryMerges;

    Result(int rounds, int categoriesBefore, int categoriesAfter, int statesBefore, int statesAfter, int categoryMerges) {
      this.rounds = rounds;
      this.categoriesBefore = categoriesBefore;
      this.categoriesAfter = categoriesAfter;
      this.statesBefore = statesBefore;
      this.statesAfter = statesAfter;
      this.categoryMerges = categoryMerges;
    }

    public boolean changed() {
      return categoriesAfter != categoriesBefore || statesAfter != statesBefore;
    }

    @Override
    public String toString() {
      return String.format("%d rounds, categories %d -> %d, states %d -> %d",
              rounds, categoriesBefore, categoriesAfter, statesBefore, statesAfter);
    }
  }

  private TableMinimizer() {
  }

  public static Result minimize(CategoryMerger categories, StateTableBuilder table) {
    checkConsistent(categories, table);

    int categoriesBefore = categories.categoryCount();
    int statesBefore = table.stateCount();
    int rounds = 0;
    int merges = 0;

    boolean changed;
    do {
      changed = false;
      rounds++;

      int from = CategoryBuilder.FIRST_CATEGORY;
      Optional<IntPair> dupl;
      while ((dupl = table.findDuplicateCategoryFrom(from)).isPresent()) {
        IntPair p = dupl.get();
        categories.mergeCategories(p.first, p.second);
        table.removeColumn(p.second);
        checkConsistent(categories, table);
        from = p.first;
        merges++;
        changed = true;
      }

      while (table.removeDuplicateStates() > 0) {
        changed = true;
      }
    } while (changed);

    Result result = new Result(rounds, categoriesBefore, categories.categoryCount(),
            statesBefore, table.stateCount(), merges);
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine("minimized: " + result);
    }
    return result;
  }

  private static void checkConsistent(CategoryMerger categories, StateTableBuilder table) {
    if (table.columnCount() != categories.categoryCount()) {
      throw new IllegalStateException("table has " + table.columnCount() + " columns but there are "
              + categories.categoryCount() + " categories");
    }
  }
}
