package com.planning.cpm.io;

import com.planning.cpm.config.DateMode;
import com.planning.cpm.config.Delimiter;
import com.planning.cpm.error.InvalidRecordException;
import org.junit.Test;

import static org.junit.Assert.*;

public class ScheduleDefinitionReaderTest {

    private static final String JSON = "{\n"
            + "  \"schedule\": {\n"
            + "    \"name\": \"House\",\n"
            + "    \"dateMode\": \"USE_SUPPLIED_DATES\",\n"
            + "    \"delimiter\": \"SEMICOLON\",\n"
            + "    \"calendarAnchor\": \"01/03/2024\",\n"
            + "    \"activities\": [\n"
            + "      { \"ActivityID\": \"A\", \"ActivityName\": \"Excavation\", \"Duration\": 5,"
            + " \"StartDate\": \"04/03/2024\", \"Notes\": \"ignored\" },\n"
            + "      { \"ActivityID\": \"B\", \"ActivityName\": \"Foundation\", \"Duration\": \"3\","
            + " \"Predecessors\": \"A\", \"LogicConstraints\": \"A[SS+2]\" }\n"
            + "    ]\n"
            + "  }\n"
            + "}";

    @Test
    public void testParsesDocument() {
        ScheduleDefinition def = ScheduleDefinitionReader.parse(JSON);
        ScheduleDefinition.ScheduleInfo info = def.getSchedule();

        assertEquals("House", info.getName());
        assertEquals(DateMode.USE_SUPPLIED_DATES, info.getDateMode());
        assertEquals(Delimiter.SEMICOLON, info.getDelimiter());
        assertEquals("01/03/2024", info.getCalendarAnchor());
        assertEquals(2, info.getActivities().size());

        ScheduleDefinition.ActivityRow a = info.getActivities().get(0);
        assertEquals("A", a.getActivityId());
        assertEquals("Excavation", a.getActivityName());
        assertEquals(Integer.valueOf(5), a.getDuration());
        assertEquals("04/03/2024", a.getStartDate());

        ScheduleDefinition.ActivityRow b = info.getActivities().get(1);
        assertEquals(Integer.valueOf(3), b.getDuration());
        assertEquals("A", b.getPredecessors());
        assertEquals("A[SS+2]", b.getLogicConstraints());
        assertNull(b.getConstraint());
    }

    @Test(expected = InvalidRecordException.class)
    public void testMalformedJson() {
        ScheduleDefinitionReader.parse("{ \"schedule\": [ ");
    }

    @Test(expected = InvalidRecordException.class)
    public void testMissingScheduleKey() {
        ScheduleDefinitionReader.parse("{ \"graph\": {} }");
    }

    @Test
    public void testNonNumericDurationRejected() {
        try {
            ScheduleDefinitionReader.parse("{ \"schedule\": { \"activities\": [ "
                    + "{ \"ActivityID\": \"A\", \"Duration\": \"five\" } ] } }");
            fail("Expected InvalidRecordException");
        } catch (InvalidRecordException e) {
            assertEquals(-1, e.row());
            assertNotNull(e.getCause());
        }
    }
}
