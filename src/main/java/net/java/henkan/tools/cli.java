package net.java.henkan.tools;

import java.io.IOException;

import net.java.henkan.HenkanFactory;
import net.java.henkan.converter.Candidate;
import net.java.henkan.converter.ImmutableConverter;
import net.java.henkan.converter.Segment;
import net.java.henkan.converter.Segments;

public class cli {

  public static void main(String args[]) throws IOException {
    if (args.length < 2) {
      System.out.println("Usage: cli <dataDir> <key>");
      return;
    }

    ImmutableConverter converter = HenkanFactory.getInstance(args[0]).getConverter();
    Segments segments = new Segments();
    if (!converter.startConversion(segments, args[1])) {
      System.out.println("Conversion failed");
      return;
    }

    for (Segment segment : segments.getConversionSegments()) {
      System.out.println(segment.getKey());
      for (int i = 0; i < segment.getCandidatesSize(); i++) {
        System.out.println("  " + i + '\t' + getAllFeatures(segment.getCandidate(i)));
      }
    }
    System.out.println("EOS");
  }

  private static String getAllFeatures(Candidate candidate) {
    //値\t内容語\tコスト\t構造コスト\t属性

    StringBuilder sb = new StringBuilder();
    sb.append(candidate.getValue());
    sb.append('\t');
    sb.append(candidate.getContentValue());
    sb.append('\t');
    sb.append(candidate.getCost());
    sb.append('\t');
    sb.append(candidate.getStructureCost());
    sb.append('\t');
    sb.append(candidate.getAttributes());

    return sb.toString();
  }
}
