package io.hyperfoil.tools.yamlint.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tracks the mapping contexts that are open at each indentation and finds keys repeated inside one context.
 * A context closes as soon as a content line appears at a lower indentation.
 */
public class ContextStack {

    private final List<MappingContext> contexts = new ArrayList<>();
    private final List<MappingContext> active = new ArrayList<>();
    private final List<DuplicateKey> duplicates = new ArrayList<>();
    private int blockScalarIndent = -1;

    public void accept(LineInfo info){
        int line = info.getLineNumber();
        if(blockScalarIndent >= 0){
            if(info.isEmpty() || info.getIndentation() > blockScalarIndent){
                return;
            }
            blockScalarIndent = -1;
        }
        if(info.isEmpty() || info.isComment()){
            return;
        }
        String text = info.getText();
        int indent = info.getIndentation();
        if(indent == 0 && LineSyntax.isDocumentMarker(text.trim())){
            closeAll(line - 1);
            return;
        }
        closeDeeper(indent, line - 1);

        String content = text.substring(indent);
        int column = indent;
        if(LineSyntax.isListMarker(content)){
            String item = LineSyntax.stripListMarkers(content);
            column += content.length() - item.length();
            content = item;
            MappingContext entry = push(line, column);
            int separator = LineSyntax.separator(content);
            if(separator >= 0){
                register(entry, content, separator, line, column);
            }else if(LineSyntax.opensBlockScalar(LineSyntax.stripComment(content).trim())){
                blockScalarIndent = indent;
            }
            return;
        }
        int separator = LineSyntax.separator(content);
        if(separator < 0){
            return;
        }
        MappingContext context = find(indent);
        if(context == null){
            context = push(line, indent);
        }
        register(context, content, separator, line, column);
    }

    public void finish(int lastLine){
        closeAll(lastLine);
    }

    private void register(MappingContext context, String content, int separator, int line, int column){
        String key = LineSyntax.key(content, separator);
        Integer first = context.addKey(key, line);
        if(first != null){
            duplicates.add(new DuplicateKey(key, first, line, column));
        }
        if(LineSyntax.opensBlockScalar(LineSyntax.value(content, separator))){
            blockScalarIndent = column;
        }
    }

    private MappingContext find(int indentation){
        for(int i = active.size() - 1; i >= 0; i--){
            if(active.get(i).getIndentation() == indentation){
                return active.get(i);
            }
        }
        return null;
    }

    private MappingContext push(int line, int indentation){
        MappingContext context = new MappingContext(line, indentation);
        contexts.add(context);
        active.add(context);
        return context;
    }

    private void closeDeeper(int indentation, int endLine){
        for(int i = active.size() - 1; i >= 0; i--){
            MappingContext context = active.get(i);
            if(context.getIndentation() > indentation){
                context.close(endLine);
                active.remove(i);
            }
        }
    }

    private void closeAll(int endLine){
        for(MappingContext context : active){
            context.close(endLine);
        }
        active.clear();
    }

    public List<MappingContext> getContexts(){return Collections.unmodifiableList(contexts);}
    public List<DuplicateKey> getDuplicates(){return Collections.unmodifiableList(duplicates);}
}
