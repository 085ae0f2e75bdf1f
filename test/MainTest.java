import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

import junit.framework.TestCase;

public class MainTest extends TestCase {

    private Path dir;

    @Override
    protected void setUp() throws IOException{
        dir = Files.createTempDirectory("main");
    }

    @Override
    protected void tearDown() throws IOException{
        MoreFiles.deleteRecursively(dir, RecursiveDeleteOption.ALLOW_INSECURE);
    }

    private Path write(String name, String content) throws IOException{
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static String read(Path file) throws IOException{
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    public void testUsageErrors(){
        assertEquals(Main.EXIT_USAGE, Main.run(new String[0]));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"bogus"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"prune", "-i", "in.nwk"}));
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"--help"}));
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"wgd", "-h"}));
    }

    public void testPrune() throws IOException{
        Path input = write("in.nwk", "((A:0.1,B:0.2)n1:0.3,(C:0.4,D:0.5)n2:0.6)root;\n");
        Path output = dir.resolve("out.nwk");
        assertEquals(Main.EXIT_OK, Main.run(new String[]{
            "prune", "-i", input.toString(), "-o", output.toString(), "-n", "B,D", "-p", "2"}));
        assertEquals("(A:0.40,C:1.00)root;\n", read(output));
    }

    public void testPruneNamesFromFile() throws IOException{
        Path input = write("in.nwk", "(A:1,B:1,C:1)r;\n");
        Path names = write("names.txt", "A\n\nC\n");
        Path output = dir.resolve("out.nwk");
        assertEquals(Main.EXIT_OK, Main.run(new String[]{
            "prune", "-i", input.toString(), "-o", output.toString(), "-f", names.toString(), "-p", "0"}));
        assertEquals("B;\n", read(output));
    }

    public void testPruneWithoutNames() throws IOException{
        Path input = write("in.nwk", "(A,B);\n");
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{
            "prune", "-i", input.toString(), "-o", dir.resolve("out.nwk").toString()}));
    }

    public void testMissingInputFile(){
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{
            "filter-leaves", "-i", dir.resolve("absent.nwk").toString(), "-o", dir.resolve("out.nwk").toString(), "-t", "3"}));
    }

    public void testBadThreshold() throws IOException{
        Path input = write("in.nwk", "(A,B);\n");
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{
            "filter-leaves", "-i", input.toString(), "-o", dir.resolve("out.nwk").toString(), "-t", "many"}));
    }

    public void testFilterLeaves() throws IOException{
        Path input = write("in.nwk", "(A,B);\n((A,B),(C,D));\n");
        Path output = dir.resolve("out.nwk");
        assertEquals(Main.EXIT_OK, Main.run(new String[]{
            "filter-leaves", "-i", input.toString(), "-o", output.toString(), "-t", "4"}));
        assertEquals("((A,B),(C,D));\n", read(output));
    }

    public void testFilterGroups() throws IOException{
        Path input = write("in.nwk", "((s1,s2),(s3,s4));\n((s1,s2),s3);\n");
        Path csv = write("groups.csv", "s1,g1\ns2,g1\ns3,g2\ns4,g3\n");
        Path output = dir.resolve("out.nwk");
        assertEquals(Main.EXIT_OK, Main.run(new String[]{
            "filter-groups", "-i", input.toString(), "-c", csv.toString(), "-o", output.toString(), "-g", "3"}));
        assertEquals("((s1,s2),(s3,s4));\n", read(output));
    }

    public void testFilterSupportDefaults() throws IOException{
        Path input = write("in.nwk", "((A:1,B:1)0.8:0.5,C:1)1.0:0.2;\n((A:1,B:1)0.6:0.5,C:1)1.0:0.2;\n");
        Path output = dir.resolve("out.nwk");
        assertEquals(Main.EXIT_OK, Main.run(new String[]{
            "filter-support", "-i", input.toString(), "-o", output.toString()}));
        assertEquals("((A:1,B:1)0.8:0.5,C:1)1.0:0.2;\n", read(output));
    }

    public void testWgdAndWgt() throws IOException{
        Path trees = Files.createDirectory(dir.resolve("trees"));
        Files.write(trees.resolve("f.nwk"), "((1,2),(3,4));\n".getBytes(StandardCharsets.UTF_8));
        Path wgd = dir.resolve("wgd.txt");
        Path wgt = dir.resolve("wgt.txt");

        assertEquals(Main.EXIT_OK, Main.run(new String[]{
            "wgd", "-d", trees.toString(), "-a", "1,2", "-b", "3,4", "-o", wgd.toString(), "-j", "1"}));
        assertTrue(read(wgd).endsWith("f.nwk\t1\t0\t1\t1\t0\t0\t1.0000\t0.0000\n"));

        assertEquals(Main.EXIT_OK, Main.run(new String[]{
            "wgt", "-d", trees.toString(), "-a", "1", "2", "-b", "3,4", "-o", wgt.toString()}));
        assertTrue(read(wgt).endsWith("f.nwk\t1\t0\t1\t1\t1.0000\t0\t0.0000\n"));
    }

    public void testOverlappingSpeciesSets() throws IOException{
        Path trees = Files.createDirectory(dir.resolve("trees"));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{
            "wgd", "-d", trees.toString(), "-a", "1,2", "-b", "2,3", "-o", dir.resolve("x.txt").toString()}));
    }

    public void testPruneWithSupportLabels() throws IOException{
        Path input = write("in.nwk", "((A:1,B:1)0.9:0.1,C:1)r;\n");
        Path output = dir.resolve("out.nwk");
        assertEquals(Main.EXIT_OK, Main.run(new String[]{
            "prune", "-i", input.toString(), "-o", output.toString(), "-n", "Z", "-p", "1", "-s"}));
        assertEquals("((A:1.0,B:1.0)0.9:0.1,C:1.0);\n", read(output));
    }
}
