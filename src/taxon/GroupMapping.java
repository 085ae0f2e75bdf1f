package taxon;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.log4j.Logger;

/**
 * GroupMapping: leaf name → group label, read from a two-column CSV file
 * without header ({@code id,group}).
 *
 * A name listed twice keeps its last group; the overwrite is logged.
 */
public class GroupMapping {

    private static final Logger logger = Logger.getLogger(GroupMapping.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setTrim(true)
        .setIgnoreEmptyLines(true)
        .build();

    private final Map<String, String> leafToGroup;

    public GroupMapping(Map<String, String> leafToGroup){
        this.leafToGroup = Collections.unmodifiableMap(new LinkedHashMap<>(leafToGroup));
    }

    public static GroupMapping read(Path csv) throws IOException{
        try(Reader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8)){
            GroupMapping mapping = read(reader);
            logger.info("Loaded " + mapping.size() + " names in " + mapping.groups().size() + " groups from " + csv);
            return mapping;
        }
    }

    public static GroupMapping read(Reader reader) throws IOException{
        Map<String, String> leafToGroup = new LinkedHashMap<>();
        try(CSVParser parser = FORMAT.parse(reader)){
            for(CSVRecord record : parser){
                if(record.size() < 2 || record.get(0).isEmpty() || record.get(1).isEmpty())
                    throw new IOException("Line " + parser.getCurrentLineNumber() + ": expected 'id,group', got " + record.toList());
                String previous = leafToGroup.put(record.get(0), record.get(1));
                if(previous != null && !previous.equals(record.get(1)))
                    logger.warn("Name '" + record.get(0) + "' moved from group " + previous + " to " + record.get(1));
            }
        }
        return new GroupMapping(leafToGroup);
    }

    public String groupOf(String leafName){
        return leafToGroup.get(leafName);
    }

    public Set<String> groups(){
        return new LinkedHashSet<>(leafToGroup.values());
    }

    public Map<String, String> asMap(){
        return leafToGroup;
    }

    public int size(){
        return leafToGroup.size();
    }
}
