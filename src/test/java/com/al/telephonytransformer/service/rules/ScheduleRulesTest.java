package com.al.telephonytransformer.service.rules;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.TestRecords.json;
import static org.junit.jupiter.api.Assertions.*;

public class ScheduleRulesTest {

    @Test
    public void testWeeklyRangesToCustomHours_FlattensDays() {
        Object weeklyRanges = json("{'Monday':[{'from':'08:00','to':'17:00'}],"
                + "'Friday':[{'from':'09:00','to':'12:00'},{'from':'13:00','to':'16:00'}]}");

        List<Map<String, Object>> customHours = ScheduleRules.weeklyRangesToCustomHours(weeklyRanges);

        assertEquals(3, customHours.size());
        assertEquals(json("{'weekday':2,'from':'08:00','to':'17:00','type':2}"), customHours.get(0));
        assertEquals(6, customHours.get(1).get("weekday"));
        assertEquals("16:00", customHours.get(2).get("to"));
    }

    @Test
    public void testWeeklyRangesToCustomHours_SkipsUnknownDaysAndMalformedRanges() {
        Object weeklyRanges = json("{'Funday':[{'from':'08:00','to':'17:00'}],'sunday':['bad',{'from':'1','to':'2'}]}");

        List<Map<String, Object>> customHours = ScheduleRules.weeklyRangesToCustomHours(weeklyRanges);

        assertEquals(1, customHours.size());
        assertEquals(1, customHours.get(0).get("weekday"));
    }

    @Test
    public void testWeeklyRangesToCustomHours_NonMapInput() {
        assertTrue(ScheduleRules.weeklyRangesToCustomHours(null).isEmpty());
        assertTrue(ScheduleRules.weeklyRangesToCustomHours("24/7").isEmpty());
    }

    @Test
    public void testExtractWeeklyRanges_ListOrObject() {
        Map<String, Object> asList = json("{'bh':[{'schedule':{'weeklyRanges':{'Monday':[]}}}]}");
        Map<String, Object> asObject = json("{'bh':{'schedule':{'weeklyRanges':{'Tuesday':[]}}}}");

        assertEquals(json("{'Monday':[]}"), ScheduleRules.extractWeeklyRanges(asList.get("bh")));
        assertEquals(json("{'Tuesday':[]}"), ScheduleRules.extractWeeklyRanges(asObject.get("bh")));
        assertNull(ScheduleRules.extractWeeklyRanges(null));
    }

    @Test
    public void testWeeklyRangesFromDayArrays_SkipsEmptyDays() {
        Map<String, Object> record = json("{'monday_hours':['08:00','17:00'],'sunday_hours':[],"
                + "'wednesday_hours':['10:00','14:00'],'friday_hours':'closed'}");

        Map<String, Object> weeklyRanges = ScheduleRules.weeklyRangesFromDayArrays(record, "_hours");

        assertEquals(List.of("Monday", "Wednesday"), List.copyOf(weeklyRanges.keySet()));
        assertEquals(List.of(json("{'from':'10:00','to':'14:00'}")), weeklyRanges.get("Wednesday"));
    }

    @Test
    public void testWeeklyRangesFromDaySettings_RespectsEnabledFlag() {
        Object weeklyHours = json("{'monday':{'enabled':true,'start_time':'08:00','end_time':'17:00'},"
                + "'tuesday':{'enabled':false,'start_time':'08:00','end_time':'17:00'},"
                + "'saturday':{'start_time':'10:00','end_time':'12:00'},"
                + "'sunday':{'enabled':true}}");

        Map<String, Object> weeklyRanges = ScheduleRules.weeklyRangesFromDaySettings(weeklyHours);

        assertEquals(List.of("Monday", "Saturday"), List.copyOf(weeklyRanges.keySet()));
    }

    @Test
    public void testWeekdayNumber() {
        assertEquals(1, ScheduleRules.weekdayNumber("Sunday"));
        assertEquals(7, ScheduleRules.weekdayNumber(" SATURDAY "));
        assertNull(ScheduleRules.weekdayNumber("Someday"));
    }
}
