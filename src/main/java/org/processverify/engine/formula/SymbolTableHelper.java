package org.processverify.engine.formula;

import org.processverify.engine.formula.models.ActorSymbol;
import org.processverify.engine.formula.models.SymbolTable;
import org.processverify.engine.formula.models.TaskSymbol;
import org.processverify.engine.source.DocumentHelper;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class SymbolTableHelper {

    public static SymbolTable loadSymbolTable(Path symbolFile) {
        return DocumentHelper.readDocument(symbolFile, SymbolTable.class);
    }

    /**
     * Task symbols in table order, skipping entries without one.
     */
    public static List<String> taskSymbols(SymbolTable table) {
        List<String> symbols = new ArrayList<>();
        for (TaskSymbol task : table.tasks()) {
            if (task.taskSymbol() != null && !task.taskSymbol().isBlank()) {
                symbols.add(task.taskSymbol());
            }
        }
        return symbols;
    }

    /**
     * Appends a start task {@code S<i>} ("initial of <actor>") and an end task {@code E<i>}
     * ("end of <actor>") for the i-th named actor. Actors without a symbol are referred to as {@code A<i>}.
     */
    public static SymbolTable addStartEndTasks(SymbolTable table) {
        List<TaskSymbol> tasks = new ArrayList<>(table.tasks());
        List<ActorSymbol> actors = table.actors();
        for (int i = 0; i < actors.size(); i++) {
            ActorSymbol actor = actors.get(i);
            if (actor == null || actor.actorName() == null) {
                continue;
            }
            String actorSymbol = actor.symbol() != null ? actor.symbol() : "A" + (i + 1);
            tasks.add(new TaskSymbol(actorSymbol, "initial of " + actor.actorName(), "S" + (i + 1)));
            tasks.add(new TaskSymbol(actorSymbol, "end of " + actor.actorName(), "E" + (i + 1)));
        }
        return new SymbolTable(actors, tasks);
    }
}
