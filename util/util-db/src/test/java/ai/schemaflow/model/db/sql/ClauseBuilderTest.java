package ai.schemaflow.model.db.sql;

import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class ClauseBuilderTest {

    private enum Color { RED, GREEN }

    @Test
    public void emptyConjunctionMatchesEverything() {
        var where = ClauseBuilder.conjunction()
            .add("id", null)
            .add("status", null);

        Assert.assertTrue(where.isEmpty());
        Assert.assertEquals("1 = 1", where.build());
        Assert.assertTrue(where.args().isEmpty());
    }

    @Test
    public void argumentsFollowPlaceholders() {
        var where = ClauseBuilder.conjunction()
            .add("id", 42L)
            .add("name", null)
            .addIn("color", List.of(Color.RED, Color.GREEN))
            .add("owner", "alice");

        Assert.assertEquals("id = ? AND color IN (?, ?) AND owner = ?", where.build());
        Assert.assertEquals(List.of(42L, Color.RED, Color.GREEN, "alice"), where.args());
    }

    @Test
    public void emptyInListMatchesNothing() {
        var where = ClauseBuilder.conjunction().addIn("color", List.of());

        Assert.assertEquals("1 = 0", where.build());
        Assert.assertTrue(where.args().isEmpty());
    }

    @Test
    public void assignments() {
        var set = ClauseBuilder.assignments()
            .add("updater_id", 7L)
            .addRaw("version = version + 1")
            .add("name", "release-42");

        Assert.assertEquals("updater_id = ?, version = version + 1, name = ?", set.build());
        Assert.assertEquals(List.of(7L, "release-42"), set.args());
    }

    @Test
    public void emptyAssignmentsRejected() {
        var set = ClauseBuilder.assignments().add("name", null);
        Assert.assertThrows(IllegalStateException.class, set::build);
    }

    @Test
    public void rawFragmentPlaceholdersChecked() {
        Assert.assertThrows(IllegalArgumentException.class,
            () -> ClauseBuilder.conjunction().addRaw("a = ? OR b = ?", 1));

        var where = ClauseBuilder.conjunction().addRaw("(a = ? OR b = ?)", 1, 2);
        Assert.assertEquals("(a = ? OR b = ?)", where.build());
        Assert.assertEquals(List.of(1, 2), where.args());
    }

    @Test
    public void argsAreReadOnly() {
        var where = ClauseBuilder.conjunction().add("id", 1L);
        Assert.assertThrows(UnsupportedOperationException.class, () -> where.args().add(2L));
    }
}
