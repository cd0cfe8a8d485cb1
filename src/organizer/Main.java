package organizer;

import organizer.config.AnnealingParameters;
import organizer.config.ConfigLoader;
import organizer.config.ScheduleConfig;
import organizer.config.SchedulingConfig;
import organizer.core.OptimizationJob;
import organizer.core.OptimizationReport;
import organizer.core.OptimizationRunner;
import organizer.core.Schedule;
import organizer.export.ScheduleExport;
import organizer.io.CsvDataLoader;
import organizer.model.Client;
import organizer.model.Instructor;

import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.Random;
import java.util.concurrent.ExecutionException;

public class Main {
    public static void main(String[] args) {
        if (args.length < 2) {
            System.out.println("Usage: Main <clients.csv> <instructors.csv> [config.properties] [output.xlsx|output.pdf]");
            System.exit(2);
        }
        try {
            Path clientsPath = Path.of(args[0]);
            Path instructorsPath = Path.of(args[1]);
            Path configPath = args.length > 2 ? Path.of(args[2]) : null;
            Path outputPath = args.length > 3 ? Path.of(args[3]) : null;

            Properties props = ConfigLoader.load(configPath);
            ScheduleConfig config = ConfigLoader.toScheduleConfig(props);
            AnnealingParameters parameters = ConfigLoader.toAnnealingParameters(props);

            List<Client> clients = CsvDataLoader.loadClients(clientsPath);
            List<Instructor> instructors = CsvDataLoader.loadInstructors(instructorsPath);

            Schedule schedule = new Schedule(config, clients, instructors);
            schedule.generateRandomSchedule(parameters.isGreedyInitialPlacement(),
                    new Random(SchedulingConfig.RANDOM_SEED));

            System.out.println("\nINITIAL SCHEDULE");
            System.out.println(schedule);
            System.out.println("Initial earnings: " + schedule.getCost());

            OptimizationReport report;
            try (OptimizationRunner runner = new OptimizationRunner()) {
                OptimizationJob job = runner.submit(schedule, parameters, SchedulingConfig.RANDOM_SEED, null);
                report = job.get();
            }

            System.out.println("\nOPTIMIZED SCHEDULE");
            System.out.println(schedule);
            System.out.println("Number of iterations: " + report.getIterations());
            System.out.println("Best earnings: " + report.getAnnealedCost());
            System.out.println("Improved earnings: " + report.getFinalCost()
                    + " (" + report.getLessonsMoved() + " lessons moved)");
            System.out.println("Time: " + report.getElapsedMillis() + " ms");
            System.out.println(report.getInitialCost() + " $ --> " + report.getAnnealedCost() + " $ --> "
                    + report.getFinalCost() + " $");

            if (outputPath != null) {
                if (outputPath.toString().toLowerCase().endsWith(".pdf")) {
                    ScheduleExport.exportPdf(schedule, outputPath);
                } else {
                    ScheduleExport.exportExcel(schedule, outputPath);
                }
            }
        } catch (ExecutionException e) {
            System.err.println("Optimization failed: " + e.getCause().getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }
}
