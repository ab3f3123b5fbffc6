/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.parser;

import graphql.language.Definition;
import graphql.language.DirectiveDefinition;
import graphql.language.Document;
import graphql.language.EnumTypeDefinition;
import graphql.language.InputObjectTypeDefinition;
import graphql.language.InterfaceTypeDefinition;
import graphql.language.ObjectTypeDefinition;
import graphql.language.OperationTypeDefinition;
import graphql.language.SDLExtensionDefinition;
import graphql.language.ScalarTypeDefinition;
import graphql.language.SchemaDefinition;
import graphql.language.Type;
import graphql.language.TypeName;
import graphql.language.UnionTypeDefinition;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.graphql.planner.exceptions.FailedParsingSchemaException;
import org.opensearch.graphql.planner.query.Directive;
import org.opensearch.graphql.planner.query.OperationType;
import org.opensearch.graphql.planner.schema.FieldDefinition;
import org.opensearch.graphql.planner.schema.SchemaDocument;
import org.opensearch.graphql.planner.schema.TypeDefinition;
import org.opensearch.graphql.planner.schema.TypeKind;
import org.opensearch.graphql.planner.schema.TypeReference;

/**
 * Parses supergraph SDL into a {@link SchemaDocument}. Type extensions are merged into the type
 * they extend, whichever comes first in the document.
 */
@Log4j2
public class SchemaParser {

  /**
   * Parse schema SDL.
   *
   * @param sdl composed schema text
   * @return the schema document
   * @throws FailedParsingSchemaException if the text is not valid SDL or references unknown types
   */
  public SchemaDocument parse(String sdl) {
    Document document;
    try {
      document = Parser.parse(sdl);
    } catch (InvalidSyntaxException e) {
      throw new FailedParsingSchemaException("Failed parsing schema: " + e.getMessage(), e);
    }

    Map<String, TypeBuilder> builders = new LinkedHashMap<>();
    Map<OperationType, String> rootTypeNames = new EnumMap<>(OperationType.class);
    List<Directive> schemaDirectives = new ArrayList<>();

    for (Definition<?> definition : document.getDefinitions()) {
      if (definition instanceof SchemaDefinition schema) {
        for (OperationTypeDefinition root : schema.getOperationTypeDefinitions()) {
          rootTypeNames.put(toOperationType(root.getName()), root.getTypeName().getName());
        }
        schemaDirectives.addAll(AstConverter.toDirectives(schema.getDirectives()));
      } else if (definition instanceof graphql.language.TypeDefinition<?> type) {
        addType(builders, type);
      } else if (!(definition instanceof DirectiveDefinition)) {
        throw new FailedParsingSchemaException(
            "Schema must only contain type system definitions, found "
                + definition.getClass().getSimpleName());
      }
    }

    Map<String, TypeDefinition> types = new LinkedHashMap<>();
    for (String scalar : SchemaDocument.BUILT_IN_SCALARS) {
      types.put(scalar, TypeDefinition.scalar(scalar));
    }
    builders.forEach((name, builder) -> types.put(name, builder.build()));

    if (rootTypeNames.isEmpty()) {
      for (OperationType operationType : OperationType.values()) {
        String defaultName = defaultRootTypeName(operationType);
        if (types.containsKey(defaultName)) {
          rootTypeNames.put(operationType, defaultName);
        }
      }
    }
    validate(types, rootTypeNames);

    log.debug("Parsed schema with {} types", types.size());
    return new SchemaDocument(types, rootTypeNames, schemaDirectives);
  }

  private void addType(Map<String, TypeBuilder> builders, graphql.language.TypeDefinition<?> type) {
    TypeKind kind = kindOf(type);
    boolean extension = type instanceof SDLExtensionDefinition;
    TypeBuilder builder = builders.computeIfAbsent(type.getName(), n -> new TypeBuilder(n, kind));
    if (builder.kind != kind) {
      throw new FailedParsingSchemaException(
          "Type \"" + type.getName() + "\" is declared as both " + builder.kind + " and " + kind);
    }
    if (!extension) {
      if (builder.defined) {
        throw new FailedParsingSchemaException(
            "There can be only one type named \"" + type.getName() + "\"");
      }
      builder.defined = true;
    }
    builder.directives.addAll(AstConverter.toDirectives(type.getDirectives()));

    if (type instanceof ObjectTypeDefinition object) {
      builder.addFields(object.getFieldDefinitions());
      builder.addTypeNames(object.getImplements(), builder.interfaces);
    } else if (type instanceof InterfaceTypeDefinition iface) {
      builder.addFields(iface.getFieldDefinitions());
    } else if (type instanceof UnionTypeDefinition union) {
      builder.addTypeNames(union.getMemberTypes(), builder.unionMembers);
    }
  }

  private TypeKind kindOf(graphql.language.TypeDefinition<?> type) {
    if (type instanceof ObjectTypeDefinition) {
      return TypeKind.OBJECT;
    } else if (type instanceof InterfaceTypeDefinition) {
      return TypeKind.INTERFACE;
    } else if (type instanceof UnionTypeDefinition) {
      return TypeKind.UNION;
    } else if (type instanceof EnumTypeDefinition) {
      return TypeKind.ENUM;
    } else if (type instanceof InputObjectTypeDefinition) {
      return TypeKind.INPUT_OBJECT;
    } else if (type instanceof ScalarTypeDefinition) {
      return TypeKind.SCALAR;
    }
    throw new FailedParsingSchemaException(
        "Unsupported type definition: " + type.getClass().getSimpleName());
  }

  private void validate(Map<String, TypeDefinition> types, Map<OperationType, String> roots) {
    String queryType = roots.get(OperationType.QUERY);
    if (queryType == null || !types.containsKey(queryType)) {
      throw new FailedParsingSchemaException("Schema does not define a query root type");
    }
    for (Map.Entry<OperationType, String> root : roots.entrySet()) {
      TypeDefinition rootType = types.get(root.getValue());
      if (rootType == null || !rootType.isObject()) {
        throw new FailedParsingSchemaException(
            "Root " + root.getKey().getKeyword() + " type \"" + root.getValue() + "\" must be an"
                + " object type");
      }
    }
    for (TypeDefinition type : types.values()) {
      for (FieldDefinition field : type.getFields().values()) {
        String returnType = field.getType().getNamedType();
        if (!types.containsKey(returnType)) {
          throw new FailedParsingSchemaException(
              "Unknown type \"" + returnType + "\" referenced by field "
                  + type.getName() + "." + field.getName());
        }
      }
      for (String iface : type.getInterfaces()) {
        TypeDefinition ifaceType = types.get(iface);
        if (ifaceType == null || ifaceType.getKind() != TypeKind.INTERFACE) {
          throw new FailedParsingSchemaException(
              "Type \"" + type.getName() + "\" implements unknown interface \"" + iface + "\"");
        }
      }
      for (String member : type.getUnionMembers()) {
        TypeDefinition memberType = types.get(member);
        if (memberType == null || !memberType.isObject()) {
          throw new FailedParsingSchemaException(
              "Union \"" + type.getName() + "\" has unknown object member \"" + member + "\"");
        }
      }
    }
  }

  private static OperationType toOperationType(String keyword) {
    for (OperationType type : OperationType.values()) {
      if (type.getKeyword().equals(keyword)) {
        return type;
      }
    }
    throw new FailedParsingSchemaException("Unknown root operation type: " + keyword);
  }

  private static String defaultRootTypeName(OperationType operationType) {
    String keyword = operationType.getKeyword();
    return Character.toUpperCase(keyword.charAt(0)) + keyword.substring(1);
  }

  /** Accumulates the declarations of one type name. */
  @RequiredArgsConstructor
  private static class TypeBuilder {
    private final String name;
    private final TypeKind kind;
    private final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
    private final List<String> interfaces = new ArrayList<>();
    private final List<String> unionMembers = new ArrayList<>();
    private final List<Directive> directives = new ArrayList<>();
    private boolean defined;

    void addFields(List<graphql.language.FieldDefinition> definitions) {
      for (graphql.language.FieldDefinition definition : definitions) {
        if (fields.containsKey(definition.getName())) {
          throw new FailedParsingSchemaException(
              "Field \"" + name + "." + definition.getName() + "\" can only be defined once");
        }
        Map<String, TypeReference> arguments = new LinkedHashMap<>();
        definition
            .getInputValueDefinitions()
            .forEach(a -> arguments.put(a.getName(), AstConverter.toTypeReference(a.getType())));
        fields.put(
            definition.getName(),
            new FieldDefinition(
                definition.getName(),
                AstConverter.toTypeReference(definition.getType()),
                arguments,
                AstConverter.toDirectives(definition.getDirectives())));
      }
    }

    @SuppressWarnings("rawtypes")
    void addTypeNames(List<Type> types, List<String> into) {
      for (Type type : types) {
        String typeName = ((TypeName) type).getName();
        if (!into.contains(typeName)) {
          into.add(typeName);
        }
      }
    }

    TypeDefinition build() {
      return new TypeDefinition(name, kind, fields, interfaces, unionMembers, directives);
    }
  }
}
