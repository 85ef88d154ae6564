package edu.kyoto.fos.regdot.region;

import edu.kyoto.fos.regdot.Fixtures;
import edu.kyoto.fos.regdot.cfg.BasicBlock;
import edu.kyoto.fos.regdot.printer.RegionClusterPrinter;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.Assert.*;

public class RegionTest {

  @Test
  public void testIdsUniqueAcrossThreads() throws Exception {
    BasicBlock entry = Fixtures.block();
    int threads = 4, perThread = 2000;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Callable<List<String>>> jobs = new ArrayList<>();
      for(int i = 0; i < threads; i++) {
        jobs.add(() -> {
          List<String> names = new ArrayList<>();
          for(int j = 0; j < perThread; j++) {
            names.add(RegionClusterPrinter.clusterName(new Region(entry, true)));
          }
          return names;
        });
      }
      Set<String> seen = new HashSet<>();
      for(Future<List<String>> f : pool.invokeAll(jobs)) {
        seen.addAll(f.get());
      }
      assertEquals(threads * perThread, seen.size());
    } finally {
      pool.shutdownNow();
    }
  }
}
