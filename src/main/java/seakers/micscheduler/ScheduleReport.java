package seakers.micscheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import seakers.micscheduler.decoding.DecodedSchedule;
import seakers.micscheduler.decoding.ScheduledTask;
import seakers.micscheduler.model.ResourceCapacity;
import seakers.micscheduler.model.ResourceType;
import seakers.micscheduler.model.WorkingCalendar;
import seakers.micscheduler.moeaclasses.OptimizationResult;
import seakers.micscheduler.moeaclasses.ParetoMember;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.util.Map;
import java.util.StringJoiner;

/**
 * CSV output of schedules, Pareto fronts and resource utilisation
 */
public class ScheduleReport {

    private static final Logger log = LoggerFactory.getLogger(ScheduleReport.class);

    private final String saveDirectory;

    public ScheduleReport(String saveDirectory) {
        this.saveDirectory = saveDirectory;
    }

    private File prepare(String filename) throws IOException {
        File saveFile = new File(this.saveDirectory + File.separator + filename);
        File parent = saveFile.getParentFile();
        if (parent != null && !parent.isDirectory() && !parent.mkdirs()) {
            throw new IOException("Could not create directory " + parent);
        }
        return saveFile;
    }

    public File saveSchedule(String filename, DecodedSchedule schedule, WorkingCalendar calendar) throws IOException {
        File saveFile = prepare(filename);
        log.info("Saving schedule of {} tasks to {}", schedule.getEntries().size(), saveFile);

        try (FileWriter writer = new FileWriter(saveFile)) {
            StringJoiner headings = new StringJoiner(",");
            headings.add("TaskID").add("Cluster").add("StartHour").add("EndHour").add("Start").add("End").add("Frozen");
            for (ResourceType type : ResourceType.values()) {
                headings.add(type.getLabel());
            }
            writer.append(headings.toString());
            writer.append("\n");

            for (ScheduledTask entry : schedule.getEntries()) {
                StringJoiner sj = new StringJoiner(",");
                sj.add(Integer.toString(entry.getTaskId()));
                sj.add(Integer.toString(entry.getClusterId()));
                sj.add(Integer.toString(entry.getStart()));
                sj.add(Integer.toString(entry.getEnd()));
                sj.add(calendar.dateTimeAt(entry.getStart()).toString());
                sj.add(calendar.dateTimeAt(entry.getEnd()).toString());
                sj.add(Boolean.toString(entry.isFrozen()));
                for (int units : entry.getUnits()) {
                    sj.add(Integer.toString(units));
                }
                writer.append(sj.toString());
                writer.append("\n");
            }
            writer.flush();
        }
        return saveFile;
    }

    public File saveFront(String filename, OptimizationResult result) throws IOException {
        File saveFile = prepare(filename);
        log.info("Saving Pareto front of {} schedules to {}", result.getFront().size(), saveFile);

        try (FileWriter writer = new FileWriter(saveFile)) {
            StringJoiner headings = new StringJoiner(",");
            headings.add("Cost").add("Risk").add("Delay").add("Rank").add("Crowding").add("Feasible").add("Chromosome");
            writer.append(headings.toString());
            writer.append("\n");

            for (ParetoMember member : result.getFront()) {
                StringJoiner sj = new StringJoiner(",");
                sj.add(Double.toString(member.getCost()));
                sj.add(Double.toString(member.getRisk()));
                sj.add(Double.toString(member.getDelay()));
                sj.add(Integer.toString(member.getRank()));
                sj.add(Double.toString(member.getCrowding()));
                sj.add(Boolean.toString(member.getSchedule().isFeasible()));
                sj.add(member.getChromosome().toString());
                writer.append(sj.toString());
                writer.append("\n");
            }
            writer.flush();
        }
        return saveFile;
    }

    public File saveUtilization(String filename, DecodedSchedule schedule, ResourceCapacity capacity) throws IOException {
        File saveFile = prepare(filename);
        log.info("Saving resource utilisation over {} hours to {}", schedule.getUtilization().size(), saveFile);

        try (FileWriter writer = new FileWriter(saveFile)) {
            StringJoiner headings = new StringJoiner(",");
            headings.add("Hour");
            for (ResourceType type : ResourceType.values()) {
                headings.add(type.getLabel() + " used");
                headings.add(type.getLabel() + " capacity");
            }
            writer.append(headings.toString());
            writer.append("\n");

            for (Map.Entry<Integer, int[]> slot : schedule.getUtilization().entrySet()) {
                StringJoiner sj = new StringJoiner(",");
                sj.add(Integer.toString(slot.getKey()));
                for (ResourceType type : ResourceType.values()) {
                    sj.add(Integer.toString(slot.getValue()[type.ordinal()]));
                    sj.add(Integer.toString(capacity.capacityAt(type.ordinal(), slot.getKey())));
                }
                writer.append(sj.toString());
                writer.append("\n");
            }
            writer.flush();
        }
        return saveFile;
    }
}
