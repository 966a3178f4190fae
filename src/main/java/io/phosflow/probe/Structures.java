package io.phosflow.probe;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads Cartesian structures from {@code .xyz} source files.
 */
public final class Structures {
    private Structures() {
    }

    public static List<Atom> readXyz(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read structure: " + file, e);
        }
        return parseXyz(lines, file.toString());
    }

    static List<Atom> parseXyz(List<String> lines, String origin) {
        if (lines.size() < 2) {
            throw new IllegalArgumentException("Truncated xyz file: " + origin);
        }
        int declared;
        try {
            declared = Integer.parseInt(lines.get(0).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("xyz atom count is not a number in " + origin, e);
        }
        List<Atom> atoms = new ArrayList<>(declared);
        for (int i = 2; i < lines.size() && atoms.size() < declared; i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\\s+");
            if (parts.length < 4) {
                throw new IllegalArgumentException("Malformed xyz line " + (i + 1) + " in " + origin);
            }
            atoms.add(new Atom(
                    Elements.normalize(parts[0]),
                    Double.parseDouble(parts[1]),
                    Double.parseDouble(parts[2]),
                    Double.parseDouble(parts[3])
            ));
        }
        if (atoms.size() != declared) {
            throw new IllegalArgumentException(
                    "xyz declares " + declared + " atoms but lists " + atoms.size() + " in " + origin);
        }
        return atoms;
    }
}
